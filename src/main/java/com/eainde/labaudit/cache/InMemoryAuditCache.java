package com.eainde.labaudit.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache. Used by tests and by deployments that do not persist results.
 */
public class InMemoryAuditCache implements AuditCache {

    private final Map<String, String> storage = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storage.get(key));
    }

    @Override
    public void put(String key, String value) {
        if (key == null || value == null) {
            return;
        }
        storage.put(key, value);
    }

    @Override
    public void invalidate(String key) {
        if (key != null) {
            storage.remove(key);
        }
    }

    @Override
    public int size() {
        return storage.size();
    }
}
