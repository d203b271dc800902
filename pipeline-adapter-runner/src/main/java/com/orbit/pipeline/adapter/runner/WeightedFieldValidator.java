package com.orbit.pipeline.adapter.runner;

import com.orbit.pipeline.core.contract.StructuredRecord;
import com.orbit.pipeline.core.contract.ValidationReport;
import com.orbit.pipeline.core.spi.Validator;

import java.util.ArrayList;
import java.util.List;

/**
 * 필드 존재 여부에 가중치를 매기는 기본 Validator.
 *
 * <p><strong>가중치 (합계 100):</strong></p>
 * <pre>
 * 기본 정보 (20)  legal_name 5, website 5, founded_year 5, description 5
 * 투자 (30)       total_raised_usd 15, funding_events 15
 * 조직 (20)       leadership 10, founders 10
 * 제품 (15)       products 15
 * 지표 (15)       snapshots 8, visibility 7
 * </pre>
 *
 * <p>funding_events, leadership, founders, products가 비어 있으면 이슈로 보고합니다.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class WeightedFieldValidator implements Validator {

    private static final List<Rule> RULES = List.of(
        new Rule("legal_name", 5, null),
        new Rule("website", 5, null),
        new Rule("founded_year", 5, null),
        new Rule("description", 5, null),
        new Rule("total_raised_usd", 15, null),
        new Rule("funding_events", 15, "No funding events"),
        new Rule("leadership", 10, "No leadership data"),
        new Rule("founders", 10, "No founder information"),
        new Rule("products", 15, "No product data"),
        new Rule("snapshots", 8, null),
        new Rule("visibility", 7, null)
    );

    @Override
    public ValidationReport validate(StructuredRecord record) {
        int score = 0;
        List<String> issues = new ArrayList<>();
        for (Rule rule : RULES) {
            if (record.has(rule.field())) {
                score += rule.weight();
            } else if (rule.missingIssue() != null) {
                issues.add(rule.missingIssue());
            }
        }
        return new ValidationReport(score, issues);
    }

    private record Rule(String field, int weight, String missingIssue) {
    }
}
