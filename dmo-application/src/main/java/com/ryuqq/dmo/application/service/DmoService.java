package com.ryuqq.dmo.application.service;

import com.ryuqq.dmo.application.report.ReportEngine;
import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.model.Activity;
import com.ryuqq.dmo.core.model.ActivityPatch;
import com.ryuqq.dmo.core.model.CompletionRecord;
import com.ryuqq.dmo.core.model.NewActivity;
import com.ryuqq.dmo.core.model.NewRoutine;
import com.ryuqq.dmo.core.model.Routine;
import com.ryuqq.dmo.core.model.RoutinePatch;
import com.ryuqq.dmo.core.model.RoutineState;
import com.ryuqq.dmo.core.report.DailyReport;
import com.ryuqq.dmo.core.report.MonthlyReport;
import com.ryuqq.dmo.core.report.RangeSummary;
import com.ryuqq.dmo.core.spi.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 루틴 추적 유스케이스 파사드.
 *
 * <p>CRUD는 백엔드에 그대로 위임하고, 상태 전이(activate/deactivate), 완료 표시 편의
 * 메서드, 활동 재정렬, 리포트를 추가로 제공합니다. 백엔드의 생명주기(init/close)는
 * 호출자가 관리합니다.</p>
 *
 * <p><strong>루틴 상태 전이:</strong></p>
 * <pre>
 * ACTIVE ──deactivate──&gt; INACTIVE
 * INACTIVE ──activate──&gt; ACTIVE
 * (이미 목표 상태이면 변경 없이 현재 값 반환, delete는 어느 상태에서든 종료)
 * </pre>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public class DmoService {

    private static final Logger log = LoggerFactory.getLogger(DmoService.class);

    private final StorageBackend storage;
    private final ReportEngine reports;

    public DmoService(StorageBackend storage) {
        this(storage, new ReportEngine(storage));
    }

    /**
     * 리포트 엔진을 직접 주입하는 생성자.
     *
     * @param storage 저장소 백엔드
     * @param reports 리포트 엔진
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DmoService(StorageBackend storage, ReportEngine reports) {
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        if (reports == null) {
            throw new IllegalArgumentException("reports cannot be null");
        }
        this.storage = storage;
        this.reports = reports;
    }

    // ============================================================
    // Routines
    // ============================================================

    public Routine createRoutine(NewRoutine routine) {
        return storage.createRoutine(routine);
    }

    public Routine getRoutine(long routineId) {
        return storage.getRoutine(routineId);
    }

    public List<Routine> listRoutines(boolean includeInactive) {
        return storage.listRoutines(includeInactive);
    }

    public Routine updateRoutine(long routineId, RoutinePatch patch) {
        return storage.updateRoutine(routineId, patch);
    }

    public void deleteRoutine(long routineId) {
        storage.deleteRoutine(routineId);
        log.debug("Deleted routine {}", routineId);
    }

    /**
     * INACTIVE → ACTIVE.
     *
     * @param routineId 루틴 ID
     * @return 활성 상태의 루틴
     */
    public Routine activate(long routineId) {
        return transition(routineId, RoutineState.ACTIVE);
    }

    /**
     * ACTIVE → INACTIVE. 기록은 유지되고 일간/전체 월간 리포트에서만 빠집니다.
     *
     * @param routineId 루틴 ID
     * @return 비활성 상태의 루틴
     */
    public Routine deactivate(long routineId) {
        return transition(routineId, RoutineState.INACTIVE);
    }

    // ============================================================
    // Activities
    // ============================================================

    public Activity createActivity(NewActivity activity) {
        return storage.createActivity(activity);
    }

    public Activity getActivity(long activityId) {
        return storage.getActivity(activityId);
    }

    public List<Activity> listActivities(long routineId) {
        return storage.listActivities(routineId);
    }

    public Activity updateActivity(long activityId, ActivityPatch patch) {
        return storage.updateActivity(activityId, patch);
    }

    public void deleteActivity(long activityId) {
        storage.deleteActivity(activityId);
    }

    /**
     * 활동 순서를 주어진 ID 순서대로 0부터 다시 매깁니다.
     *
     * <p>모든 ID를 먼저 검증한 뒤 갱신하므로 검증 실패 시 아무것도 바뀌지 않습니다.
     * 목록에 없는 활동의 order는 그대로입니다.</p>
     *
     * @param routineId 루틴 ID
     * @param activityIds 원하는 순서의 활동 ID
     * @return 재정렬 후 활동 목록
     * @throws DmoException ROUTINE_NOT_FOUND, ACTIVITY_NOT_FOUND,
     *                      INVALID_INPUT (다른 루틴의 활동이거나 중복 ID)
     */
    public List<Activity> reorderActivities(long routineId, List<Long> activityIds) {
        if (activityIds == null) {
            throw new IllegalArgumentException("activityIds cannot be null");
        }
        storage.getRoutine(routineId);

        Set<Long> seen = new HashSet<>();
        for (Long activityId : activityIds) {
            if (activityId == null) {
                throw new IllegalArgumentException("activityIds cannot contain null");
            }
            if (!seen.add(activityId)) {
                throw DmoException.invalidInput("Duplicate activity id in reorder request: " + activityId);
            }
            Activity activity = storage.getActivity(activityId);
            if (activity.routineId() != routineId) {
                throw DmoException.invalidInput(
                    "Activity " + activityId + " belongs to DMO " + activity.routineId() + ", not " + routineId);
            }
        }

        for (int position = 0; position < activityIds.size(); position++) {
            storage.updateActivity(activityIds.get(position), ActivityPatch.ofOrder(position));
        }
        log.debug("Reordered {} activities of routine {}", activityIds.size(), routineId);
        return storage.listActivities(routineId);
    }

    // ============================================================
    // Completions
    // ============================================================

    public CompletionRecord setCompletion(long routineId, LocalDate date, boolean completed, String note) {
        return storage.setCompletion(routineId, date, completed, note);
    }

    public CompletionRecord markComplete(long routineId, LocalDate date, String note) {
        return storage.setCompletion(routineId, date, true, note);
    }

    public CompletionRecord markIncomplete(long routineId, LocalDate date, String note) {
        return storage.setCompletion(routineId, date, false, note);
    }

    public Optional<CompletionRecord> getCompletion(long routineId, LocalDate date) {
        return storage.getCompletion(routineId, date);
    }

    public List<CompletionRecord> listCompletions(long routineId, LocalDate start, LocalDate end) {
        return storage.listCompletions(routineId, start, end);
    }

    public int countCompleted(long routineId, LocalDate start, LocalDate end) {
        return storage.countCompleted(routineId, start, end);
    }

    // ============================================================
    // Reports
    // ============================================================

    public DailyReport dailyReport(LocalDate date) {
        return reports.daily(date);
    }

    public List<MonthlyReport> monthlyReports(int year, int month) {
        return reports.monthly(year, month);
    }

    public MonthlyReport monthlyReport(int year, int month, long routineId) {
        return reports.monthly(year, month, routineId);
    }

    public RangeSummary summary(long routineId, LocalDate start, LocalDate end) {
        return reports.rangeSummary(routineId, start, end);
    }

    private Routine transition(long routineId, RoutineState target) {
        Routine current = storage.getRoutine(routineId);
        if (current.state() == target) {
            return current;
        }
        Routine updated = storage.updateRoutine(routineId, RoutinePatch.empty().withActive(target.isActive()));
        log.info("Routine {} ('{}') {} -> {}", routineId, updated.name(), current.state(), target);
        return updated;
    }
}
