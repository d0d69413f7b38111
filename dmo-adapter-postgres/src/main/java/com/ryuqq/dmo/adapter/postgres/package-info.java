/**
 * Networked storage adapter on PostgreSQL with a bounded HikariCP pool.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dmo.adapter.postgres.PostgresStorageBackend} - the backend</li>
 *   <li>{@link com.ryuqq.dmo.adapter.postgres.PostgresConfig} - URL, credentials and pool bounds</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.adapter.postgres;
