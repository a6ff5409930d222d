package com.ryuqq.runnertype.core.outcome;

import com.ryuqq.runnertype.core.model.RunnerTypeId;
import com.ryuqq.runnertype.core.model.RunnerTypeRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome Sealed Interface 테스트.
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
class OutcomeTest {

    private static RunnerTypeRecord record(String description) {
        return new RunnerTypeRecord(RunnerTypeId.of("rt-1"), "run-local", description,
            true, "runners.local", null, null);
    }

    @Test
    void typePredicates_MatchConcreteType() {
        // Given
        Outcome created = new Created("run-local", record("d"));
        Outcome updated = new Updated("run-local", record("d"), record("d"));
        Outcome skipped = Skipped.experimental("run-windows-cmd");
        Outcome failed = Failed.of("run-remote", FailureKind.LOOKUP, "store unavailable");

        // Then
        assertTrue(created.isCreated() && created.isPersisted());
        assertTrue(updated.isUpdated() && updated.isPersisted());
        assertTrue(skipped.isSkipped());
        assertFalse(skipped.isPersisted());
        assertTrue(failed.isFailed());
        assertFalse(failed.isPersisted());
    }

    @Test
    void created_NullRecord_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Created("run-local", null));
        assertThrows(IllegalArgumentException.class, () -> new Created(null, record("d")));
    }

    @Test
    void updated_ContentChanged_ComparesPreviousAndStored() {
        assertFalse(new Updated("run-local", record("d"), record("d")).contentChanged());
        assertTrue(new Updated("run-local", record("old"), record("new")).contentChanged());
    }

    @Test
    void updated_NullPrevious_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Updated("run-local", null, record("d")));
    }

    @Test
    void skipped_Experimental_UsesStandardReason() {
        // When
        Skipped skipped = Skipped.experimental("run-windows-script");

        // Then
        assertEquals("run-windows-script", skipped.definitionName());
        assertEquals(Skipped.EXPERIMENTAL_EXCLUDED, skipped.reason());
    }

    @Test
    void skipped_BlankReason_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Skipped("run-local", " "));
    }
}
