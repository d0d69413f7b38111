package com.ryuqq.dmo.core.model;

import com.ryuqq.dmo.core.error.DmoException;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 특정 날짜의 루틴 완료 판정.
 *
 * <p><strong>핵심 불변식:</strong> (routineId, date) 쌍마다 최대 하나의 레코드.
 * 같은 키로 다시 쓰면 id와 createdAt은 유지되고 completed/note/updatedAt만 바뀝니다.</p>
 *
 * @param id 레코드 ID
 * @param routineId 소유 루틴 ID
 * @param date 날짜 (시간 없음)
 * @param completed 완료 여부
 * @param note 메모 (null 허용, 최대 2000자)
 * @param createdAt 생성 시각 (UTC)
 * @param updatedAt 수정 시각 (UTC)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record CompletionRecord(
    long id,
    long routineId,
    LocalDate date,
    boolean completed,
    String note,
    Instant createdAt,
    Instant updatedAt
) {

    /**
     * 메모 최대 길이.
     */
    public static final int MAX_NOTE_LENGTH = 2000;

    public CompletionRecord {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
    }

    /**
     * 저장 전 메모 검증.
     *
     * <p>모든 백엔드가 같은 규칙을 적용하도록 여기서 한 번만 정의합니다.</p>
     *
     * @param note 메모 (null 허용)
     * @return 입력 그대로의 메모
     * @throws DmoException 2000자를 초과하는 경우 (INVALID_INPUT)
     */
    public static String validateNote(String note) {
        if (note != null) {
            Texts.requireMaxLength("note", note, MAX_NOTE_LENGTH);
        }
        return note;
    }
}
