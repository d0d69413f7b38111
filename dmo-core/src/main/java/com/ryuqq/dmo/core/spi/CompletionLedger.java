package com.ryuqq.dmo.core.spi;

import com.ryuqq.dmo.core.model.CompletionRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Completion Ledger SPI, keyed by (routine id, date).
 *
 * <p>The write path is upsert-only. At most one record exists per key; a second write
 * mutates the first record in place (id and createdAt preserved).</p>
 *
 * <p><strong>Idempotence Law:</strong></p>
 * <pre>
 * r1 = setCompletion(r, d, c, n);
 * r2 = setCompletion(r, d, c, n);
 * r1.id() == r2.id() &amp;&amp; r1.completed() == r2.completed() &amp;&amp; Objects.equals(r1.note(), r2.note())
 * </pre>
 *
 * <p><strong>Range rules</strong> (listCompletions, countCompleted):</p>
 * <ul>
 *   <li>Both bounds inclusive</li>
 *   <li>start &gt; end → INVALID_RANGE, checked before the routine lookup</li>
 *   <li>Unknown routine → ROUTINE_NOT_FOUND</li>
 * </ul>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public interface CompletionLedger {

    /**
     * Upserts the completion judgment for a routine on a date.
     *
     * <pre>
     * INSERT INTO completions (routine_id, date, completed, note, created_at, updated_at)
     * VALUES (?, ?, ?, ?, now, now)
     * ON CONFLICT (routine_id, date) DO UPDATE
     *   SET completed = EXCLUDED.completed, note = EXCLUDED.note, updated_at = EXCLUDED.updated_at;
     * </pre>
     *
     * @param routineId the routine id
     * @param date the calendar date
     * @param completed whether the routine was completed
     * @param note optional note (max 2000 characters), null allowed
     * @return the created or updated record
     * @throws IllegalArgumentException if date is null
     * @throws com.ryuqq.dmo.core.error.DmoException ROUTINE_NOT_FOUND if the routine is absent,
     *         INVALID_INPUT if the note is too long
     */
    CompletionRecord setCompletion(long routineId, LocalDate date, boolean completed, String note);

    /**
     * Reads the record for a key.
     *
     * @param routineId the routine id
     * @param date the calendar date
     * @return the record, or empty if nothing was written for this key
     * @throws com.ryuqq.dmo.core.error.DmoException ROUTINE_NOT_FOUND if the routine is absent
     */
    Optional<CompletionRecord> getCompletion(long routineId, LocalDate date);

    /**
     * Lists records in a date range, ascending by date.
     *
     * @param routineId the routine id
     * @param start first date (inclusive)
     * @param end last date (inclusive)
     * @return records within [start, end], possibly empty
     * @throws com.ryuqq.dmo.core.error.DmoException INVALID_RANGE, ROUTINE_NOT_FOUND
     */
    List<CompletionRecord> listCompletions(long routineId, LocalDate start, LocalDate end);

    /**
     * Counts records with {@code completed == true} in a date range without materialising them.
     *
     * <pre>
     * SELECT COUNT(*) FROM completions
     * WHERE routine_id = ? AND date BETWEEN ? AND ? AND completed;
     * </pre>
     *
     * @param routineId the routine id
     * @param start first date (inclusive)
     * @param end last date (inclusive)
     * @return number of completed days
     * @throws com.ryuqq.dmo.core.error.DmoException INVALID_RANGE, ROUTINE_NOT_FOUND
     */
    int countCompleted(long routineId, LocalDate start, LocalDate end);
}
