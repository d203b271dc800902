package com.orbit.pipeline.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SubjectKey, CacheKey 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class SubjectKeyTest {

    @Test
    void normalizedId_LowercasesAndReplacesSpacesAndDots() {
        // Given
        SubjectKey key = SubjectKey.of("  Acme Co. Holdings ");

        // When
        String normalized = key.normalizedId();

        // Then
        assertEquals("acme_co_holdings", normalized);
        assertEquals("  Acme Co. Holdings ", key.getValue());
    }

    @Test
    void of_Blank_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> SubjectKey.of(" "));
        assertThrows(IllegalArgumentException.class, () -> SubjectKey.of(null));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> SubjectKey.of("a".repeat(256)));
    }

    @Test
    void cacheKey_DifferentSpellings_ConvergeToSameKey() {
        // When
        CacheKey first = CacheKey.of(SubjectKey.of("AcmeCo"), Variant.STRUCTURED);
        CacheKey second = CacheKey.of(SubjectKey.of("acmeco"), Variant.of("structured"));

        // Then
        assertEquals("live_dashboard_acmeco_structured", first.getValue());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void cacheKey_PrefixSharingSubjects_HaveDistinctKeys() {
        // When
        CacheKey acme = CacheKey.of(SubjectKey.of("Acme"), Variant.STRUCTURED);
        CacheKey acmeCo = CacheKey.of(SubjectKey.of("Acme Co"), Variant.STRUCTURED);

        // Then
        assertEquals("live_dashboard_acme_structured", acme.getValue());
        assertEquals("live_dashboard_acme_co_structured", acmeCo.getValue());
        assertNotEquals(acme, acmeCo);
    }

    @Test
    void variant_InvalidCharacters_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Variant.of("rag/v2"));
    }

    @Test
    void runId_Generate_IsUnique() {
        // When
        RunId first = RunId.generate();
        RunId second = RunId.generate();

        // Then
        assertNotEquals(first, second);
    }
}
