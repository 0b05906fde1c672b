package com.project.lepidoptera.landmarks.cache;

final class DisabledResultCache implements ResultCache {
    static final DisabledResultCache INSTANCE = new DisabledResultCache();

    private DisabledResultCache() {}

    @Override
    public Object get(String key) {
        return null;
    }

    @Override
    public void put(String key, Object value) {
        // stores nothing
    }

    @Override
    public void clear() {
        // nothing stored
    }
}
