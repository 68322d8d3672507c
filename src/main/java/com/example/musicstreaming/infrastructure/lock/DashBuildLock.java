package com.example.musicstreaming.infrastructure.lock;

/**
 * Cross-pod mutual exclusion for asset builds, keyed by cache key.
 */
public interface DashBuildLock {

    /**
     * @return a token identifying this holder, or {@code null} when someone else holds the lock
     */
    String tryAcquire(String cacheKey);

    /**
     * Releases the lock only if it is still held with {@code token}.
     */
    void release(String cacheKey, String token);

    boolean isHeld(String cacheKey);
}
