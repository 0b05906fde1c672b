package com.project.lepidoptera.landmarks.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/** Bounded cache evicting the least recently accessed entry. */
public class LruResultCache implements ResultCache {
    private final Map<String, Object> cache;

    public LruResultCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + capacity);
        }
        this.cache = new LinkedHashMap<String, Object>(capacity, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Object> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public synchronized Object get(String key) {
        return cache.get(key);
    }

    @Override
    public synchronized void put(String key, Object value) {
        cache.put(key, value);
    }

    @Override
    public synchronized void clear() {
        cache.clear();
    }

    public synchronized int size() {
        return cache.size();
    }
}
