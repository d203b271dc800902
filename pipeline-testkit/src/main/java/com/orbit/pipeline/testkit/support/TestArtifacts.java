package com.orbit.pipeline.testkit.support;

import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.core.contract.CacheEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fixture factory for artifacts and cache entries.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public final class TestArtifacts {

    private TestArtifacts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates a structured artifact with a score of 85.
     *
     * @param subjectId normalized subject id
     * @param generatedAt generation timestamp
     * @return artifact
     */
    public static Artifact artifact(String subjectId, Instant generatedAt) {
        return new Artifact(
            subjectId,
            "structured",
            "# " + subjectId + "\n\nFounded 2015.",
            "markdown",
            85,
            List.of("No funding events"),
            "B",
            generatedAt,
            Map.of("pagesFetched", "3")
        );
    }

    /**
     * Creates a cache entry wrapping {@link #artifact(String, Instant)}.
     *
     * @param key cache key
     * @param createdAt creation timestamp
     * @param ttl time to live
     * @return cache entry
     */
    public static CacheEntry<Artifact> entry(String key, Instant createdAt, Duration ttl) {
        return new CacheEntry<>(key, artifact("acmeco", createdAt), createdAt, createdAt.plus(ttl), 0, "B", "0123456789abcdef");
    }
}
