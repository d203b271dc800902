package com.orbit.pipeline.core.contract;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ValidationReport, StructuredRecord 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class ValidationReportTest {

    @ParameterizedTest
    @CsvSource({"100,A", "90,A", "89,B", "75,B", "74,C", "60,C", "59,D", "40,D", "39,F", "0,F"})
    void grade_FollowsScoreThresholds(int score, String expected) {
        // When & Then
        assertEquals(expected, new ValidationReport(score, List.of()).grade());
    }

    @Test
    void constructor_ScoreOutOfRange_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new ValidationReport(101, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ValidationReport(-1, List.of()));
    }

    @Test
    void structuredRecordHas_TreatsEmptyValuesAsAbsent() {
        // Given
        Map<String, Object> fields = new java.util.HashMap<>();
        fields.put("legal_name", "Acme Co");
        fields.put("website", " ");
        fields.put("founders", List.of());
        fields.put("leadership", Map.of());
        fields.put("founded_year", 2015);
        fields.put("description", null);
        StructuredRecord record = new StructuredRecord("acmeco", fields);

        // When & Then
        assertTrue(record.has("legal_name"));
        assertTrue(record.has("founded_year"));
        assertFalse(record.has("website"));
        assertFalse(record.has("founders"));
        assertFalse(record.has("leadership"));
        assertFalse(record.has("description"));
        assertFalse(record.has("missing"));
    }
}
