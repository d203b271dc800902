package com.orbit.pipeline.core.model;

import java.util.Locale;

/**
 * 파이프라인 대상(Subject)의 식별자.
 *
 * <p>회사명 등 사람이 읽을 수 있는 이름을 그대로 보관하며,
 * 캐시 키와 파일명에 사용할 정규화된 ID({@link #normalizedId()})를 제공합니다.</p>
 *
 * <p><strong>정규화 규칙:</strong></p>
 * <ul>
 *   <li>앞뒤 공백 제거 후 소문자 변환</li>
 *   <li>공백 → 언더스코어(_)</li>
 *   <li>마침표(.) 제거</li>
 * </ul>
 *
 * <p>예: {@code "Acme Co."} → {@code "acme_co"}</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class SubjectKey {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private SubjectKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SubjectKey cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("SubjectKey length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * SubjectKey 생성.
     *
     * @param value 대상 이름 (예: "AcmeCo")
     * @return SubjectKey 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열이거나 255자를 초과하는 경우
     */
    public static SubjectKey of(String value) {
        return new SubjectKey(value);
    }

    /**
     * 원본 이름 조회.
     *
     * @return 생성 시 전달된 이름
     */
    public String getValue() {
        return value;
    }

    /**
     * 정규화된 ID 조회.
     *
     * @return 소문자, 공백은 언더스코어, 마침표 제거
     */
    public String normalizedId() {
        return value.trim()
            .toLowerCase(Locale.ROOT)
            .replace(" ", "_")
            .replace(".", "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubjectKey that = (SubjectKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SubjectKey{" + value + '}';
    }
}
