package com.ryuqq.dmo.core.model;

import com.ryuqq.dmo.core.error.DmoException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RoutinePatch / ActivityPatch merge-patch 테스트.
 *
 * @author DMO Team
 * @since 1.0.0
 */
class RoutinePatchTest {

    private static final Instant T0 = Instant.parse("2026-02-01T09:00:00Z");
    private static final Instant T1 = Instant.parse("2026-02-01T10:00:00Z");

    @Test
    void empty_IsEmpty() {
        assertTrue(RoutinePatch.empty().isEmpty());
        assertFalse(RoutinePatch.empty().withActive(false).isEmpty());
    }

    @Test
    void applyTo_OnlySuppliedFieldsChange() {
        // Given
        Routine current = new Routine(1L, "Run", "5km", true, "UTC", T0, T0);
        RoutinePatch patch = RoutinePatch.empty().withDescription("10km").withActive(false);

        // When
        Routine updated = patch.applyTo(current, T1);

        // Then
        assertEquals(1L, updated.id());
        assertEquals("Run", updated.name());
        assertEquals("10km", updated.description());
        assertEquals("UTC", updated.timezone());
        assertFalse(updated.active());
        assertEquals(RoutineState.INACTIVE, updated.state());
        assertEquals(T0, updated.createdAt());
        assertEquals(T1, updated.updatedAt());
    }

    @Test
    void withName_IsTrimmedAndValidated() {
        assertEquals("Walk", RoutinePatch.empty().withName("  Walk ").name());
        assertThrows(DmoException.class, () -> RoutinePatch.empty().withName(" "));
    }

    @Test
    void activityPatch_ApplyTo_KeepsOmittedFields() {
        // Given
        Activity current = new Activity(5L, 1L, "Meditate", 2, T0, T0);

        // When
        Activity moved = ActivityPatch.ofOrder(0).applyTo(current, T1);
        Activity renamed = ActivityPatch.ofName("Breathe").applyTo(current, T1);

        // Then
        assertEquals("Meditate", moved.name());
        assertEquals(0, moved.order());
        assertEquals("Breathe", renamed.name());
        assertEquals(2, renamed.order());
        assertEquals(T0, renamed.createdAt());
    }

    @Test
    void activityPatch_NegativeOrder_ThrowsInvalidInput() {
        assertThrows(DmoException.class, () -> ActivityPatch.ofOrder(-3));
    }

    @Test
    void activityPatch_Empty_IsEmpty() {
        assertTrue(new ActivityPatch(null, null).isEmpty());
    }
}
