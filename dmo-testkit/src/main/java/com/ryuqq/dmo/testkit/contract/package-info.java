/**
 * Reusable storage backend contract suite.
 *
 * <p>Adapter modules depend on this module in test scope and extend
 * {@link com.ryuqq.dmo.testkit.contract.AbstractStorageBackendContractTest}.</p>
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.testkit.contract;
