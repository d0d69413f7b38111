/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage contract that infrastructure adapters implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dmo.core.spi.EntityStore} - Routine and activity CRUD</li>
 *   <li>{@link com.ryuqq.dmo.core.spi.CompletionLedger} - Upsert-only (routine, date) ledger</li>
 *   <li>{@link com.ryuqq.dmo.core.spi.StorageBackend} - Both of the above plus lifecycle</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (dmo-adapter-inmemory, dmo-adapter-sqlite, dmo-adapter-postgres)
 * provide the implementations. Every adapter must pass the contract suite in dmo-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any database driver</li>
 *   <li><strong>Parity:</strong> Swapping adapters never changes observable results</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.core.spi;
