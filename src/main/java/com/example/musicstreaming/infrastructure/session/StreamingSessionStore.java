package com.example.musicstreaming.infrastructure.session;

import com.example.musicstreaming.domain.model.StreamingSession;
import java.time.Instant;
import java.util.List;

public interface StreamingSessionStore {

    void save(StreamingSession session);

    StreamingSession findById(String sessionId);

    /**
     * @return the removed record, or {@code null} when nothing was stored under the id
     */
    StreamingSession deleteById(String sessionId);

    List<StreamingSession> findExpired(Instant now);
}
