package com.ryuqq.dmo.core.spi;

/**
 * A complete persistence engine: entity store, completion ledger and lifecycle.
 *
 * <p>Callers depend on this interface only. The in-memory, SQLite and PostgreSQL
 * adapters implement it with identical externally observable behavior.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * StorageBackend backend = ...;
 * backend.init();            // creates schema/state if absent; safe to repeat
 * try {
 *     backend.createRoutine(NewRoutine.of("Morning Routine"));
 * } finally {
 *     backend.close();       // releases connections; init() again before reuse
 * }
 * </pre>
 *
 * <p>Any data operation before {@link #init()} or after {@link #close()} fails with
 * {@link com.ryuqq.dmo.core.error.DmoException} (STORAGE_FAILURE).</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public interface StorageBackend extends EntityStore, CompletionLedger, AutoCloseable {

    /**
     * Initializes the backend. Idempotent.
     *
     * @throws com.ryuqq.dmo.core.error.DmoException STORAGE_FAILURE or STORAGE_UNAVAILABLE
     *         if the engine cannot be reached or the schema cannot be created
     */
    void init();

    /**
     * Releases all resources held by the backend. Calling it twice is harmless.
     */
    @Override
    void close();

    /**
     * Short engine name used in logs and configuration (e.g. {@code sqlite}).
     *
     * @return engine name
     */
    String name();
}
