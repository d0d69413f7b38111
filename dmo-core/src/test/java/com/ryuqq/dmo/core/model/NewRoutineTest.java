package com.ryuqq.dmo.core.model;

import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.error.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NewRoutine / NewActivity 입력 검증 테스트.
 *
 * @author DMO Team
 * @since 1.0.0
 */
class NewRoutineTest {

    @Test
    void of_NameWithSurroundingSpaces_IsTrimmed() {
        // When
        NewRoutine routine = NewRoutine.of("  Morning Routine \t");

        // Then
        assertEquals("Morning Routine", routine.name());
        assertNull(routine.description());
        assertNull(routine.timezone());
    }

    @Test
    void of_BlankName_ThrowsInvalidInput() {
        DmoException exception = assertThrows(DmoException.class, () -> NewRoutine.of("   "));
        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
        assertTrue(exception.getMessage().contains("cannot be empty"));
    }

    @Test
    void of_NullName_ThrowsInvalidInput() {
        DmoException exception = assertThrows(DmoException.class, () -> NewRoutine.of(null));
        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
    }

    @Test
    void of_NameAtMaxLength_IsAccepted() {
        String name = "a".repeat(NewRoutine.MAX_NAME_LENGTH);

        assertEquals(name, NewRoutine.of(name).name());
    }

    @Test
    void of_NameOverMaxLength_ThrowsInvalidInput() {
        String name = "a".repeat(NewRoutine.MAX_NAME_LENGTH + 1);

        DmoException exception = assertThrows(DmoException.class, () -> NewRoutine.of(name));
        assertTrue(exception.getMessage().contains("cannot exceed 255"));
    }

    @Test
    void of_SupplementaryCharacters_CountedAsOneEach() {
        // U+1F3C3 takes two UTF-16 units
        String runner = "\uD83C\uDFC3";
        String name = runner.repeat(NewRoutine.MAX_NAME_LENGTH);

        assertEquals(name, NewRoutine.of(name).name());

        DmoException exception = assertThrows(DmoException.class, () -> NewRoutine.of(name + runner));
        assertTrue(exception.getMessage().contains("(current: 256)"));
    }

    @Test
    void constructor_TimezoneTooLong_ThrowsInvalidInput() {
        String timezone = "z".repeat(NewRoutine.MAX_TIMEZONE_LENGTH + 1);

        assertThrows(DmoException.class, () -> new NewRoutine("Run", null, timezone));
    }

    @Test
    void newActivity_NegativeOrder_ThrowsInvalidInput() {
        DmoException exception = assertThrows(DmoException.class, () -> new NewActivity(1L, "Meditate", -1));
        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
    }

    @Test
    void newActivity_Of_DefaultsOrderToZero() {
        NewActivity activity = NewActivity.of(3L, " Meditate ");

        assertEquals(0, activity.order());
        assertEquals("Meditate", activity.name());
        assertEquals(3L, activity.routineId());
    }

    @Test
    void newActivity_NameOverMaxLength_ThrowsInvalidInput() {
        String name = "n".repeat(NewActivity.MAX_NAME_LENGTH + 1);

        assertThrows(DmoException.class, () -> NewActivity.of(1L, name));
    }
}
