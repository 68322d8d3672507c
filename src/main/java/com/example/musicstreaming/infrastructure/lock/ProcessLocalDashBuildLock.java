package com.example.musicstreaming.infrastructure.lock;

import java.util.UUID;

/**
 * Used when no shared lock store is configured: every acquire succeeds and no other holder is ever
 * reported, leaving coordination to the in-process build tracker.
 */
public class ProcessLocalDashBuildLock implements DashBuildLock {

    @Override
    public String tryAcquire(String cacheKey) {
        return UUID.randomUUID().toString();
    }

    @Override
    public void release(String cacheKey, String token) {
        // nothing shared to release
    }

    @Override
    public boolean isHeld(String cacheKey) {
        return false;
    }
}
