package com.eainde.labaudit.cache;

import java.util.Optional;

/**
 * Always misses. Every audit calls the inference models.
 */
public class DisabledAuditCache implements AuditCache {

    @Override
    public Optional<String> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, String value) {
        // nothing is stored
    }

    @Override
    public void invalidate(String key) {
        // nothing is stored
    }

    @Override
    public int size() {
        return 0;
    }
}
