package com.orbit.pipeline.adapter.inmemory.store;

import com.orbit.pipeline.core.contract.Artifact;
import com.orbit.pipeline.testkit.contract.AbstractCacheStoreContractTest;

/**
 * Contract tests for {@link InMemoryCacheStore}.
 *
 * <p>The in-memory store is not durable, so "reopening" returns the same instance.</p>
 *
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
class InMemoryCacheStoreContractTest extends AbstractCacheStoreContractTest<InMemoryCacheStore<Artifact>> {

    @Override
    protected InMemoryCacheStore<Artifact> createStore() {
        return new InMemoryCacheStore<>();
    }

    @Override
    protected InMemoryCacheStore<Artifact> reopen() {
        return store;
    }
}
