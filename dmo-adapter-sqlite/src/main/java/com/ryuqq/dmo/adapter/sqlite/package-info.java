/**
 * Embedded single-file storage adapter on SQLite.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dmo.adapter.sqlite.SqliteStorageBackend} - the backend</li>
 *   <li>{@link com.ryuqq.dmo.adapter.sqlite.SqliteConfig} - file location and lock timeout</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.adapter.sqlite;
