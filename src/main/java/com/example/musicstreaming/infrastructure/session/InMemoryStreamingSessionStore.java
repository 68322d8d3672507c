package com.example.musicstreaming.infrastructure.session;

import com.example.musicstreaming.domain.model.StreamingSession;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * Process-local session records. Records are stored as copies so callers cannot mutate them in place.
 */
@Component
public class InMemoryStreamingSessionStore implements StreamingSessionStore {

    private final ConcurrentMap<String, StreamingSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(StreamingSession session) {
        sessions.put(session.getSessionId(), session.copy());
    }

    @Override
    public StreamingSession findById(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        StreamingSession stored = sessions.get(sessionId);
        return stored == null ? null : stored.copy();
    }

    @Override
    public StreamingSession deleteById(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        return sessions.remove(sessionId);
    }

    @Override
    public List<StreamingSession> findExpired(Instant now) {
        List<StreamingSession> expired = new ArrayList<>();
        for (StreamingSession session : sessions.values()) {
            if (session.isExpiredAt(now)) {
                expired.add(session.copy());
            }
        }
        return expired;
    }
}
