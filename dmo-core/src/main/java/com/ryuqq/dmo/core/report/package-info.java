/**
 * Report values and the pure computations behind them.
 *
 * <p>{@link com.ryuqq.dmo.core.report.Streaks} and
 * {@link com.ryuqq.dmo.core.report.CompletionRates} hold the only non-trivial
 * arithmetic; they never touch storage. The report records are plain immutable
 * values assembled by the application layer.</p>
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.core.report;
