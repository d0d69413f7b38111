/**
 * Date, time and ordering helpers that every backend and the report engine share,
 * so that all engines round and sort identically.
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.core.util;
