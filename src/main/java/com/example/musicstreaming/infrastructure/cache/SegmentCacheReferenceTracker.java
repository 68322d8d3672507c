package com.example.musicstreaming.infrastructure.cache;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Records which sessions use which built asset so that cache eviction skips assets still being played.
 */
@Component
public class SegmentCacheReferenceTracker {

    private final Map<String, String> cacheKeyBySession = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByCacheKey = new ConcurrentHashMap<>();

    public synchronized void registerSessionReference(String sessionId, String cacheKey) {
        if (sessionId == null || cacheKey == null) {
            return;
        }
        String previous = cacheKeyBySession.put(sessionId, cacheKey);
        if (previous != null && !previous.equals(cacheKey)) {
            detach(previous, sessionId);
        }
        sessionsByCacheKey.computeIfAbsent(cacheKey, key -> new HashSet<>()).add(sessionId);
    }

    public synchronized void clearSessionReference(String sessionId) {
        if (sessionId == null) {
            return;
        }
        String cacheKey = cacheKeyBySession.remove(sessionId);
        if (cacheKey != null) {
            detach(cacheKey, sessionId);
        }
    }

    public synchronized boolean hasActiveReferences(String cacheKey) {
        Set<String> sessions = sessionsByCacheKey.get(cacheKey);
        return sessions != null && !sessions.isEmpty();
    }

    public synchronized Set<String> getReferencedCacheKeys() {
        return Collections.unmodifiableSet(new HashSet<>(sessionsByCacheKey.keySet()));
    }

    private void detach(String cacheKey, String sessionId) {
        Set<String> sessions = sessionsByCacheKey.get(cacheKey);
        if (sessions == null) {
            return;
        }
        sessions.remove(sessionId);
        if (sessions.isEmpty()) {
            sessionsByCacheKey.remove(cacheKey);
        }
    }
}
