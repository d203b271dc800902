package com.orbit.pipeline.core.model;

/**
 * 파이프라인 변형(Variant) 식별자.
 *
 * <p>같은 대상이라도 렌더링 방식이 다르면 별도의 결과물과 캐시 엔트리를 가집니다
 * (예: {@code structured}, {@code rag}).</p>
 *
 * <p><strong>유효성 검증:</strong> 영숫자, 하이픈(-), 언더스코어(_)만 허용</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class Variant {

    /** 구조화 추출 결과 기반 대시보드. */
    public static final Variant STRUCTURED = new Variant("structured");

    /** 벡터 검색(RAG) 기반 대시보드. */
    public static final Variant RAG = new Variant("rag");

    private final String value;

    private Variant(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Variant cannot be null or blank");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException(
                "Variant contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed (current: " + value + ")"
            );
        }
        this.value = value;
    }

    /**
     * Variant 생성.
     *
     * @param value Variant 이름
     * @return Variant 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Variant of(String value) {
        return new Variant(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Variant variant = (Variant) o;
        return value.equals(variant.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
