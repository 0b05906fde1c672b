package com.project.lepidoptera.landmarks.cache;

/**
 * Key-value store for memoized pipeline results. Values must be immutable;
 * the pipeline functions are pure, so any implementation (including one that
 * stores nothing) gives the same answers.
 */
public interface ResultCache {

    /** @return the stored value, or {@code null} when absent */
    Object get(String key);

    void put(String key, Object value);

    void clear();

    static ResultCache disabled() {
        return DisabledResultCache.INSTANCE;
    }
}
