package com.orbit.pipeline.core.contract;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인 최종 결과물.
 *
 * <p>렌더링된 문서와 함께 검증 점수, 품질 등급, 생성 시각 등 메타데이터를 보관합니다.
 * 결과 캐시에 저장되고 디스크에 그대로 직렬화되므로 모든 필드는 불변입니다.</p>
 *
 * @param subjectId 정규화된 대상 ID
 * @param variant 변형 이름
 * @param content 렌더링된 본문
 * @param format 문서 형식
 * @param score 검증 점수 (0~100)
 * @param issues 검증 문제 목록
 * @param qualityGrade 품질 등급 (A~F)
 * @param generatedAt 생성 시각
 * @param metadata 부가 정보 (수집 페이지 수, 소요 시간 등)
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record Artifact(
    String subjectId,
    String variant,
    String content,
    String format,
    int score,
    List<String> issues,
    String qualityGrade,
    Instant generatedAt,
    Map<String, String> metadata
) {

    public Artifact {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId cannot be null or blank");
        }
        if (variant == null || variant.isBlank()) {
            throw new IllegalArgumentException("variant cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (generatedAt == null) {
            throw new IllegalArgumentException("generatedAt cannot be null");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 렌더링 문서와 검증 결과로 Artifact 생성.
     *
     * @param subjectId 정규화된 대상 ID
     * @param variant 변형 이름
     * @param document 렌더링 문서
     * @param report 검증 결과
     * @param generatedAt 생성 시각
     * @param metadata 부가 정보
     * @return Artifact
     */
    public static Artifact of(String subjectId, String variant, RenderedDocument document,
                              ValidationReport report, Instant generatedAt, Map<String, String> metadata) {
        return new Artifact(
            subjectId,
            variant,
            document.content(),
            document.format(),
            report.score(),
            report.issues(),
            report.grade(),
            generatedAt,
            metadata
        );
    }
}
