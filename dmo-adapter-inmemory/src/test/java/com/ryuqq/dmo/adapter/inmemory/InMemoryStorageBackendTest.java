package com.ryuqq.dmo.adapter.inmemory;

import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.error.ErrorCode;
import com.ryuqq.dmo.core.model.NewRoutine;
import com.ryuqq.dmo.core.model.Routine;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * InMemoryStorageBackend 고유 동작 테스트.
 */
class InMemoryStorageBackendTest {

    @Test
    void constructor_NullClock_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new InMemoryStorageBackend(null)
        );
        assertEquals("clock cannot be null", exception.getMessage());
    }

    @Test
    void closeThenInit_StartsFromEmptyState() {
        // Given
        InMemoryStorageBackend backend = new InMemoryStorageBackend();
        backend.init();
        Routine original = backend.createRoutine(NewRoutine.of("Morning Routine"));

        // When
        backend.close();
        backend.init();

        // Then
        assertThat(backend.listRoutines(true)).isEmpty();
        Routine recreated = backend.createRoutine(NewRoutine.of("Morning Routine"));
        assertThat(recreated.id()).isGreaterThan(original.id());
    }

    @Test
    void idsAreNotReusedAfterDelete() {
        // Given
        InMemoryStorageBackend backend = new InMemoryStorageBackend(Clock.systemUTC());
        backend.init();
        Routine first = backend.createRoutine(NewRoutine.of("First"));
        backend.deleteRoutine(first.id());

        // When
        Routine second = backend.createRoutine(NewRoutine.of("Second"));

        // Then
        assertThat(second.id()).isGreaterThan(first.id());
    }

    @Test
    void close_WithoutInit_IsHarmless() {
        InMemoryStorageBackend backend = new InMemoryStorageBackend();
        backend.close();

        assertThatThrownBy(() -> backend.getRoutine(1L))
            .isInstanceOfSatisfying(DmoException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.STORAGE_FAILURE));
        assertEquals("memory", backend.name());
    }
}
