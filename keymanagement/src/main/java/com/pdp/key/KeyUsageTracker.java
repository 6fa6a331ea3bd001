package com.pdp.key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks which subjects (users) have been encrypted under which key.
 * A subject may contribute to an aggregate under a given key at most once;
 * a second registration is reported so the caller can refuse to double-count it.
 *
 * Thread-safe for concurrent workers.
 */
public class KeyUsageTracker {
    private static final Logger logger = LoggerFactory.getLogger(KeyUsageTracker.class);

    // Map: keyId -> Set<subjectId>
    private final ConcurrentMap<String, Set<String>> keyToSubjects = new ConcurrentHashMap<>();

    /**
     * Record that a subject was encrypted under a key.
     *
     * @return true on first registration, false if the subject was already tracked under this key
     */
    public boolean trackEncryption(String subjectId, String keyId) {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(keyId, "keyId");
        boolean added = keyToSubjects
                .computeIfAbsent(keyId, k -> ConcurrentHashMap.newKeySet())
                .add(subjectId);
        if (!added) {
            logger.warn("Subject already encrypted under key {}", keyId);
        }
        return added;
    }

    /**
     * Get count of subjects bound to a key.
     */
    public int getSubjectCount(String keyId) {
        Set<String> subjects = keyToSubjects.get(keyId);
        return (subjects != null) ? subjects.size() : 0;
    }

    /** Forget everything recorded under one key (end of its session). */
    public void release(String keyId) {
        Set<String> removed = keyToSubjects.remove(keyId);
        logger.debug("Released key {} ({} subjects)", keyId, removed == null ? 0 : removed.size());
    }
}
