package com.project.lepidoptera.landmarks.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.landmarks")
public class LandmarkProperties {

    private Cache cache = new Cache();

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public static class Cache {
        /** Memoize silhouettes and landmarks by input fingerprint. */
        private boolean enabled = true;

        /** Entries kept before the least recently used one is evicted. */
        private int capacity = 64;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }
}
