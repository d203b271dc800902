package com.orbit.pipeline.core.outcome;

import com.orbit.pipeline.core.error.ErrorKind;
import com.orbit.pipeline.core.error.ExtractionException;
import com.orbit.pipeline.core.model.RunId;
import com.orbit.pipeline.core.statemachine.PipelineStage;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StageFailure, RunOutcome 테스트.
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class StageFailureTest {

    @Test
    void of_PipelineException_UsesItsErrorCode() {
        // When
        StageFailure failure = StageFailure.of(
            PipelineStage.EXTRACTING,
            new CompletionException(new ExtractionException("missing legal_name"))
        );

        // Then
        assertEquals(PipelineStage.EXTRACTING, failure.stage());
        assertEquals(ErrorKind.PERMANENT, failure.kind());
        assertEquals("ExtractionException", failure.errorCode());
        assertEquals("missing legal_name", failure.message());
        assertInstanceOf(ExtractionException.class, failure.cause());
    }

    @Test
    void of_JdkException_UsesSimpleClassName() {
        // When
        StageFailure failure = StageFailure.of(PipelineStage.FETCHING, new TimeoutException());

        // Then
        assertEquals("TimeoutException", failure.errorCode());
        assertEquals(ErrorKind.TRANSIENT, failure.kind());
        assertEquals("java.util.concurrent.TimeoutException", failure.message());
    }

    @Test
    void of_AnonymousException_UsesFullClassName() {
        // Given
        IllegalStateException anonymous = new IllegalStateException("boom") { };

        // When
        StageFailure failure = StageFailure.of(PipelineStage.FETCHING, anonymous);

        // Then
        assertEquals(anonymous.getClass().getName(), failure.errorCode());
        assertTrue(failure.errorCode().startsWith(StageFailureTest.class.getName() + "$"));
        assertEquals(ErrorKind.PERMANENT, failure.kind());
        assertEquals("boom", failure.message());
    }

    @Test
    void constructor_TerminalStage_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new StageFailure(PipelineStage.FAILED, ErrorKind.PERMANENT, "X", "m", null));
    }

    @Test
    void runOutcome_TypeChecks() {
        // Given
        RunId runId = RunId.generate();
        RunOutcome cancelled = new Cancelled(runId, PipelineStage.FETCHING);
        RunOutcome failed = new Failed(runId, StageFailure.of(PipelineStage.FETCHING, new TimeoutException()));

        // When & Then
        assertTrue(cancelled.isCancelled());
        assertFalse(cancelled.isCompleted());
        assertTrue(failed.isFailed());
        assertEquals(runId, failed.runId());
    }
}
