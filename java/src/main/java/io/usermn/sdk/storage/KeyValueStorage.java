package io.usermn.sdk.storage;

import java.util.Map;
import java.util.Set;

/**
 * Durable string key-value store backing the token store.
 */
public interface KeyValueStorage {

    /**
     * @return an immutable, internally consistent view of every entry
     */
    Map<String, String> snapshot();

    /**
     * Applies all puts and removals as one unit. Either every change becomes visible to the next
     * {@link #snapshot()} or none does.
     *
     * @throws StorageException when the change could not be persisted; prior state is left intact
     */
    void commit(Map<String, String> puts, Set<String> removals);

    default String get(String key) {
        return snapshot().get(key);
    }
}
