package com.ryuqq.dmo.core.report;

import java.time.LocalDate;

/**
 * 월간 리포트의 하루 상태. 기록이 없으면 completed=false, note=null.
 *
 * @param date 날짜
 * @param completed 완료 여부
 * @param note 메모 (null 허용)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record DayCompletion(LocalDate date, boolean completed, String note) {

    public DayCompletion {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
    }
}
