package io.usermn.sdk.storage;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local storage. Writers are serialised; readers take the current snapshot without locking.
 */
public final class InMemoryStorage implements KeyValueStorage {

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Map<String, String> entries = Map.of();

    @Override
    public Map<String, String> snapshot() {
        return entries;
    }

    @Override
    public void commit(Map<String, String> puts, Set<String> removals) {
        lock.lock();
        try {
            entries = apply(entries, puts, removals);
        } finally {
            lock.unlock();
        }
    }

    static Map<String, String> apply(Map<String, String> current, Map<String, String> puts, Set<String> removals) {
        Map<String, String> next = new HashMap<>(current);
        if (removals != null) {
            removals.forEach(next::remove);
        }
        if (puts != null) {
            puts.forEach((key, value) -> {
                if (value == null) {
                    next.remove(key);
                } else {
                    next.put(key, value);
                }
            });
        }
        return Map.copyOf(next);
    }
}
