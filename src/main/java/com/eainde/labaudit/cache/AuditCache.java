package com.eainde.labaudit.cache;

import java.util.Optional;

/**
 * Content-addressed store for raw inference output.
 *
 * <p>Implementations never throw: a failed read is a miss and a failed write is ignored.
 * Entries never expire on their own; identical inputs must keep producing identical
 * outputs across restarts.</p>
 */
public interface AuditCache {

    Optional<String> get(String key);

    /** Last write wins. */
    void put(String key, String value);

    void invalidate(String key);

    int size();
}
