/**
 * Error taxonomy of the DMO core.
 *
 * <p>Every failure crossing the core boundary is a
 * {@link com.ryuqq.dmo.core.error.DmoException} tagged with an
 * {@link com.ryuqq.dmo.core.error.ErrorCode}. Each code belongs to exactly one
 * {@link com.ryuqq.dmo.core.error.ErrorKind}, so callers can branch exhaustively
 * with an enum switch.</p>
 *
 * <h2>Propagation Rules</h2>
 * <ul>
 *   <li>Backends translate driver exceptions at their boundary</li>
 *   <li>The report engine never raises STORAGE errors on its own</li>
 *   <li>Null arguments are programming errors and raise {@link java.lang.IllegalArgumentException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.core.error;
