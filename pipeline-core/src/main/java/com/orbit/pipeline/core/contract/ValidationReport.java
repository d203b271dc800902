package com.orbit.pipeline.core.contract;

import java.util.List;

/**
 * 구조화 레코드 검증 결과.
 *
 * <p>점수는 0~100 범위이며, 누락 필드 등 발견된 문제를 사람이 읽을 수 있는 문자열로 보관합니다.</p>
 *
 * <p><strong>품질 등급:</strong> A(90+), B(75+), C(60+), D(40+), F</p>
 *
 * @param score 검증 점수 (0~100)
 * @param issues 발견된 문제 목록 (불변)
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public record ValidationReport(int score, List<String> issues) {

    public ValidationReport {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100 (current: " + score + ")");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * 점수 기반 품질 등급.
     *
     * @return "A" ~ "F"
     */
    public String grade() {
        if (score >= 90) {
            return "A";
        }
        if (score >= 75) {
            return "B";
        }
        if (score >= 60) {
            return "C";
        }
        if (score >= 40) {
            return "D";
        }
        return "F";
    }
}
