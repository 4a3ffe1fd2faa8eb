package io.github.cyfko.proplogic.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe, size-bounded cache evicting the least recently used entry.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}. Since a lookup reorders entries, every
 * operation takes the same exclusive lock.
 * </p>
 *
 * <pre>{@code
 * BoundedLRUCache<String, Formula> cache = new BoundedLRUCache<>(2);
 * cache.put("p", p);
 * cache.put("q", q);
 * cache.get("p");          // p becomes most recently used
 * cache.put("r", r);       // evicts "q"
 * }</pre>
 *
 * @param <K> key type
 * @param <V> value type
 * @author PropLogic Team
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final Lock lock = new ReentrantLock();

    /**
     * @param maxSize maximum number of entries
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }

        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    /**
     * @return the cached value, or {@code null} if absent
     */
    public V get(K key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }
}
