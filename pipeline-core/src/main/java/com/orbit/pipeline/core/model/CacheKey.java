package com.orbit.pipeline.core.model;

/**
 * 대시보드 결과 캐시 키.
 *
 * <p>형식: {@code live_dashboard_{subjectId}_{variant}}</p>
 *
 * <p>subjectId는 {@link SubjectKey#normalizedId()}를 사용하므로 같은 대상이라면
 * 대소문자나 공백 표기가 달라도 동일한 키로 수렴합니다. 대상 단위 일괄 무효화는
 * {@code "_" + subjectId + "_"} 부분 문자열로 수행할 수 있습니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class CacheKey {

    private static final String PREFIX = "live_dashboard_";

    private final String value;

    private CacheKey(String value) {
        this.value = value;
    }

    /**
     * (대상, 변형) 조합의 캐시 키 생성.
     *
     * @param subject 대상
     * @param variant 변형
     * @return CacheKey
     * @throws IllegalArgumentException subject 또는 variant가 null인 경우
     */
    public static CacheKey of(SubjectKey subject, Variant variant) {
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
        if (variant == null) {
            throw new IllegalArgumentException("variant cannot be null");
        }
        return new CacheKey(PREFIX + subject.normalizedId() + "_" + variant.getValue());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((CacheKey) o).value);
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
