package com.ryuqq.dmo.application.report;

import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.model.Activity;
import com.ryuqq.dmo.core.model.CompletionRecord;
import com.ryuqq.dmo.core.model.Routine;
import com.ryuqq.dmo.core.report.CompletionRates;
import com.ryuqq.dmo.core.report.DailyReport;
import com.ryuqq.dmo.core.report.DayCompletion;
import com.ryuqq.dmo.core.report.MonthSummary;
import com.ryuqq.dmo.core.report.MonthlyReport;
import com.ryuqq.dmo.core.report.RangeSummary;
import com.ryuqq.dmo.core.report.RoutineDayStatus;
import com.ryuqq.dmo.core.report.Streaks;
import com.ryuqq.dmo.core.spi.CompletionLedger;
import com.ryuqq.dmo.core.spi.EntityStore;
import com.ryuqq.dmo.core.spi.StorageBackend;
import com.ryuqq.dmo.core.util.DateRanges;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 일간/월간/기간 리포트 계산기.
 *
 * <p>저장소 계약({@link EntityStore}, {@link CompletionLedger})만 사용하며 자체적으로
 * STORAGE 오류를 만들지 않습니다. 저장소가 던진 {@link DmoException}은 그대로 전파됩니다.</p>
 *
 * <p><strong>조회 비용:</strong></p>
 * <ul>
 *   <li>일간: 활성 루틴마다 getCompletion + listActivities</li>
 *   <li>월간/기간: 루틴마다 listCompletions 한 번 (날짜별 조회 없음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ReportEngine engine = new ReportEngine(backend);
 * MonthlyReport february = engine.monthly(2026, 2, routineId);
 * double rate = february.summary().completionRate();
 * </pre>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public class ReportEngine {

    private final EntityStore entities;
    private final CompletionLedger ledger;

    /**
     * 하나의 백엔드로 생성.
     *
     * @param backend 저장소 백엔드
     */
    public ReportEngine(StorageBackend backend) {
        this(backend, backend);
    }

    /**
     * 엔티티 저장소와 완료 원장을 따로 주입.
     *
     * @param entities 루틴/활동 저장소
     * @param ledger 완료 원장
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ReportEngine(EntityStore entities, CompletionLedger ledger) {
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.entities = entities;
        this.ledger = ledger;
    }

    /**
     * 특정 날짜의 일간 리포트.
     *
     * <p>활성 루틴만 이름 순으로 포함합니다. 기록이 없으면 미완료, 메모 없음으로 봅니다.</p>
     *
     * @param date 대상 날짜
     * @return 일간 리포트
     */
    public DailyReport daily(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        List<RoutineDayStatus> statuses = new ArrayList<>();
        for (Routine routine : entities.listRoutines(false)) {
            Optional<CompletionRecord> record = ledger.getCompletion(routine.id(), date);
            List<String> activityNames = entities.listActivities(routine.id()).stream()
                .map(Activity::name)
                .collect(Collectors.toList());
            statuses.add(new RoutineDayStatus(
                routine,
                record.map(CompletionRecord::completed).orElse(false),
                record.map(CompletionRecord::note).orElse(null),
                activityNames
            ));
        }
        return new DailyReport(date, statuses);
    }

    /**
     * 모든 활성 루틴의 월간 리포트 (이름 순).
     *
     * @param year 연도
     * @param month 월 (1~12)
     * @return 루틴별 월간 리포트
     * @throws DmoException INVALID_INPUT (월이 1~12 범위 밖)
     */
    public List<MonthlyReport> monthly(int year, int month) {
        YearMonth yearMonth = DateRanges.month(year, month);
        List<MonthlyReport> reports = new ArrayList<>();
        for (Routine routine : entities.listRoutines(false)) {
            reports.add(monthlyFor(routine, yearMonth));
        }
        return reports;
    }

    /**
     * 특정 루틴의 월간 리포트. 비활성 루틴도 대상이 됩니다.
     *
     * @param year 연도
     * @param month 월 (1~12)
     * @param routineId 루틴 ID
     * @return 월간 리포트
     * @throws DmoException INVALID_INPUT (월이 범위 밖), ROUTINE_NOT_FOUND
     */
    public MonthlyReport monthly(int year, int month, long routineId) {
        YearMonth yearMonth = DateRanges.month(year, month);
        return monthlyFor(entities.getRoutine(routineId), yearMonth);
    }

    /**
     * 임의 기간 요약. 작업량은 기간 길이가 아니라 저장된 완료 기록 수에 비례합니다.
     *
     * @param routineId 루틴 ID
     * @param start 시작일 (포함)
     * @param end 종료일 (포함)
     * @return 기간 요약
     * @throws DmoException INVALID_RANGE (start &gt; end, 루틴 확인보다 먼저), ROUTINE_NOT_FOUND
     */
    public RangeSummary rangeSummary(long routineId, LocalDate start, LocalDate end) {
        int totalDays = DateRanges.dayCount(start, end);
        Routine routine = entities.getRoutine(routineId);

        Set<LocalDate> completed = new HashSet<>();
        for (CompletionRecord record : ledger.listCompletions(routineId, start, end)) {
            if (record.completed()) {
                completed.add(record.date());
            }
        }
        Streaks streaks = Streaks.overRange(completed, start, end);

        return new RangeSummary(
            routine,
            start,
            end,
            totalDays,
            completed.size(),
            CompletionRates.of(completed.size(), totalDays),
            streaks.current(),
            streaks.longest()
        );
    }

    private MonthlyReport monthlyFor(Routine routine, YearMonth yearMonth) {
        List<LocalDate> days = DateRanges.days(yearMonth);
        Map<LocalDate, CompletionRecord> byDate = new HashMap<>();
        for (CompletionRecord record : ledger.listCompletions(routine.id(), yearMonth.atDay(1), yearMonth.atEndOfMonth())) {
            byDate.put(record.date(), record);
        }

        List<DayCompletion> dayCompletions = new ArrayList<>(days.size());
        Set<LocalDate> completed = new HashSet<>();
        List<LocalDate> missed = new ArrayList<>();
        for (LocalDate day : days) {
            CompletionRecord record = byDate.get(day);
            boolean done = record != null && record.completed();
            dayCompletions.add(new DayCompletion(day, done, record == null ? null : record.note()));
            if (done) {
                completed.add(day);
            } else {
                missed.add(day);
            }
        }

        Streaks streaks = Streaks.calculate(completed, days);
        MonthSummary summary = new MonthSummary(
            days.size(),
            completed.size(),
            CompletionRates.of(completed.size(), days.size()),
            streaks.current(),
            streaks.longest(),
            missed
        );
        return new MonthlyReport(routine, yearMonth.getYear(), yearMonth.getMonthValue(), dayCompletions, summary);
    }
}
