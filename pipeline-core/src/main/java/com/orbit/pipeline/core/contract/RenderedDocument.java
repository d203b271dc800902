package com.orbit.pipeline.core.contract;

/**
 * Renderer가 생성한 문서.
 *
 * @param content 렌더링된 본문 (예: Markdown)
 * @param format 문서 형식 (예: "markdown")
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record RenderedDocument(String content, String format) {

    public RenderedDocument {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("format cannot be null or blank");
        }
    }

    public int length() {
        return content.length();
    }
}
