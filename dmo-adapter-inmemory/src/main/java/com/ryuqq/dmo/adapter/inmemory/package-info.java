/**
 * Volatile storage adapter.
 *
 * <p>{@link com.ryuqq.dmo.adapter.inmemory.InMemoryStorageBackend} keeps every entity in
 * plain maps. It is the reference implementation the contract suite is written against and
 * the default backend for unit tests of the application layer.</p>
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.adapter.inmemory;
