package com.orbit.pipeline.adapter.inmemory.store;

import com.orbit.pipeline.core.contract.CacheEntry;
import com.orbit.pipeline.core.spi.CacheStore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CacheStore} SPI for testing and reference purposes.
 *
 * <p>Entries are held in a {@link ConcurrentHashMap} keyed by cache key, so save and delete
 * are O(1) and safe for concurrent use. A single instance survives a {@code ResultCache}
 * being rebuilt over it, which is enough to exercise start-up loading in tests.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use (use the JSON file store instead)</li>
 * </ul>
 *
 * @param <V> value type
 * @author Orbit Pipeline Team
 * @since 1.0.0
 */
public class InMemoryCacheStore<V> implements CacheStore<V> {

    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    @Override
    public void save(CacheEntry<V> entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.put(entry.key(), entry);
    }

    @Override
    public void delete(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        entries.remove(key);
    }

    @Override
    public List<CacheEntry<V>> loadAll() {
        return new ArrayList<>(entries.values());
    }

    /**
     * Number of stored entries.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Removes all entries.
     */
    public void clear() {
        entries.clear();
    }
}
