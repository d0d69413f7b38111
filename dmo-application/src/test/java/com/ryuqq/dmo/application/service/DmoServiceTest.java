package com.ryuqq.dmo.application.service;

import com.ryuqq.dmo.application.report.ReportEngine;
import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.error.ErrorCode;
import com.ryuqq.dmo.core.model.Activity;
import com.ryuqq.dmo.core.model.ActivityPatch;
import com.ryuqq.dmo.core.model.CompletionRecord;
import com.ryuqq.dmo.core.model.Routine;
import com.ryuqq.dmo.core.model.RoutinePatch;
import com.ryuqq.dmo.core.report.DailyReport;
import com.ryuqq.dmo.core.spi.StorageBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DmoService 유닛 테스트 (Mockito).
 */
@ExtendWith(MockitoExtension.class)
class DmoServiceTest {

    private static final Instant T0 = Instant.parse("2026-02-01T09:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2026, 2, 1);

    @Mock
    private StorageBackend storage;

    @Mock
    private ReportEngine reports;

    private DmoService service;

    @BeforeEach
    void setUp() {
        service = new DmoService(storage, reports);
    }

    @Test
    void deactivate_ActiveRoutine_PatchesActiveFalse() {
        // Given
        Routine active = routine(1L, true);
        Routine inactive = routine(1L, false);
        when(storage.getRoutine(1L)).thenReturn(active);
        when(storage.updateRoutine(1L, RoutinePatch.empty().withActive(false))).thenReturn(inactive);

        // When
        Routine result = service.deactivate(1L);

        // Then
        assertSame(inactive, result);
    }

    @Test
    void deactivate_AlreadyInactive_IsNoOp() {
        // Given
        Routine inactive = routine(1L, false);
        when(storage.getRoutine(1L)).thenReturn(inactive);

        // When
        Routine result = service.deactivate(1L);

        // Then
        assertSame(inactive, result);
        verify(storage, never()).updateRoutine(anyLong(), any());
    }

    @Test
    void activate_AlreadyActive_IsNoOp() {
        Routine active = routine(2L, true);
        when(storage.getRoutine(2L)).thenReturn(active);

        assertSame(active, service.activate(2L));
        verify(storage, never()).updateRoutine(anyLong(), any());
    }

    @Test
    void activate_InactiveRoutine_PatchesActiveTrue() {
        when(storage.getRoutine(2L)).thenReturn(routine(2L, false));
        when(storage.updateRoutine(2L, RoutinePatch.empty().withActive(true))).thenReturn(routine(2L, true));

        assertThat(service.activate(2L).active()).isTrue();
    }

    @Test
    void markComplete_DelegatesWithCompletedTrue() {
        // Given
        CompletionRecord record = new CompletionRecord(1L, 3L, DAY, true, "yes", T0, T0);
        when(storage.setCompletion(3L, DAY, true, "yes")).thenReturn(record);

        // When / Then
        assertSame(record, service.markComplete(3L, DAY, "yes"));
    }

    @Test
    void markIncomplete_DelegatesWithCompletedFalse() {
        CompletionRecord record = new CompletionRecord(1L, 3L, DAY, false, null, T0, T0);
        when(storage.setCompletion(3L, DAY, false, null)).thenReturn(record);

        assertSame(record, service.markIncomplete(3L, DAY, null));
    }

    @Test
    void reorderActivities_AssignsPositionsInGivenOrder() {
        // Given
        when(storage.getRoutine(1L)).thenReturn(routine(1L, true));
        when(storage.getActivity(20L)).thenReturn(activity(20L, 1L));
        when(storage.getActivity(10L)).thenReturn(activity(10L, 1L));
        List<Activity> relisted = List.of(activity(20L, 1L), activity(10L, 1L));
        when(storage.listActivities(1L)).thenReturn(relisted);

        // When
        List<Activity> result = service.reorderActivities(1L, List.of(20L, 10L));

        // Then
        InOrder order = inOrder(storage);
        order.verify(storage).updateActivity(20L, ActivityPatch.ofOrder(0));
        order.verify(storage).updateActivity(10L, ActivityPatch.ofOrder(1));
        assertEquals(relisted, result);
    }

    @Test
    void reorderActivities_ActivityOfAnotherRoutine_FailsBeforeAnyUpdate() {
        // Given
        when(storage.getRoutine(1L)).thenReturn(routine(1L, true));
        when(storage.getActivity(10L)).thenReturn(activity(10L, 1L));
        when(storage.getActivity(30L)).thenReturn(activity(30L, 2L));

        // When / Then
        assertThatThrownBy(() -> service.reorderActivities(1L, List.of(10L, 30L)))
            .isInstanceOfSatisfying(DmoException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_INPUT));
        verify(storage, never()).updateActivity(anyLong(), any());
    }

    @Test
    void reorderActivities_DuplicateId_FailsWithInvalidInput() {
        when(storage.getRoutine(1L)).thenReturn(routine(1L, true));
        when(storage.getActivity(10L)).thenReturn(activity(10L, 1L));

        assertThatThrownBy(() -> service.reorderActivities(1L, List.of(10L, 10L)))
            .isInstanceOfSatisfying(DmoException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_INPUT));
        verify(storage, never()).updateActivity(anyLong(), any());
    }

    @Test
    void reorderActivities_UnknownRoutine_PropagatesNotFound() {
        when(storage.getRoutine(9L)).thenThrow(DmoException.routineNotFound(9L));

        assertThatThrownBy(() -> service.reorderActivities(9L, List.of(1L)))
            .isInstanceOfSatisfying(DmoException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.ROUTINE_NOT_FOUND));
    }

    @Test
    void dailyReport_DelegatesToEngine() {
        DailyReport report = new DailyReport(DAY, List.of());
        when(reports.daily(DAY)).thenReturn(report);

        assertSame(report, service.dailyReport(DAY));
    }

    @Test
    void constructor_NullStorage_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new DmoService(null, reports)
        );
        assertEquals("storage cannot be null", exception.getMessage());
    }

    private static Routine routine(long id, boolean active) {
        return new Routine(id, "Routine " + id, null, active, null, T0, T0);
    }

    private static Activity activity(long id, long routineId) {
        return new Activity(id, routineId, "Activity " + id, 0, T0, T0);
    }
}
