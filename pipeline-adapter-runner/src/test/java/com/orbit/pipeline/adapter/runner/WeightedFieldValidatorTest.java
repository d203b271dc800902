package com.orbit.pipeline.adapter.runner;

import com.orbit.pipeline.core.contract.StructuredRecord;
import com.orbit.pipeline.core.contract.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static java.util.Map.entry;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * WeightedFieldValidator 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class WeightedFieldValidatorTest {

    private final WeightedFieldValidator validator = new WeightedFieldValidator();

    @Test
    void 모든_필드가_있으면_100점이고_이슈가_없음() {
        // given
        StructuredRecord record = new StructuredRecord("acmeco", Map.ofEntries(
            entry("legal_name", "AcmeCo Inc."),
            entry("website", "https://acme.example"),
            entry("founded_year", 2019),
            entry("description", "Robotics"),
            entry("total_raised_usd", 50_000_000L),
            entry("funding_events", List.of("Seed", "Series A")),
            entry("leadership", List.of("CEO")),
            entry("founders", List.of("Jane Doe")),
            entry("products", List.of("Arm")),
            entry("snapshots", List.of("2026-01")),
            entry("visibility", Map.of("news", 12))
        ));

        // when
        ValidationReport report = validator.validate(record);

        // then
        assertThat(report.score()).isEqualTo(100);
        assertThat(report.issues()).isEmpty();
        assertThat(report.grade()).isEqualTo("A");
    }

    @Test
    void 빈_레코드는_0점이고_핵심_누락_이슈를_순서대로_보고함() {
        // when
        ValidationReport report = validator.validate(new StructuredRecord("acmeco", Map.of()));

        // then
        assertThat(report.score()).isZero();
        assertThat(report.issues()).containsExactly(
            "No funding events",
            "No leadership data",
            "No founder information",
            "No product data"
        );
    }

    @Test
    void 빈_문자열과_빈_목록은_누락으로_취급함() {
        // given
        StructuredRecord record = new StructuredRecord("acmeco", Map.of(
            "legal_name", " ",
            "funding_events", List.of(),
            "products", List.of("Arm")
        ));

        // when
        ValidationReport report = validator.validate(record);

        // then
        assertThat(report.score()).isEqualTo(15);
        assertThat(report.issues()).contains("No funding events").doesNotContain("No product data");
    }
}
