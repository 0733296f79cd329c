package com.ai.supportdesk.service;

import com.ai.supportdesk.conversation.DialogueGraph;
import com.ai.supportdesk.conversation.SessionState;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory session table. Each session object is its own lock; the table itself needs
 * no cross-session coordination.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    public static final String DEFAULT_SESSION_ID = "default_user";

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final String rootId;
    private final int maxHistoryDepth;

    public SessionStore(DialogueGraph graph,
                        @Value("${support.history.max-depth:10}") int maxHistoryDepth) {
        this.rootId = graph.getRootId();
        this.maxHistoryDepth = maxHistoryDepth;
    }

    public SessionState getOrCreate(String sessionId) {
        String key = key(sessionId);
        return sessions.computeIfAbsent(key, id -> {
            log.info("[{}] new session", id);
            return new SessionState(id, rootId, maxHistoryDepth);
        });
    }

    public Optional<SessionState> find(String sessionId) {
        return Optional.ofNullable(sessions.get(key(sessionId)));
    }

    public void remove(String sessionId) {
        SessionState removed = sessions.remove(key(sessionId));
        if (removed != null) {
            synchronized (removed) {
                removed.markEvicted();
            }
        }
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Drops sessions idle for longer than {@code idleTimeout}. Each session is checked and
     * removed under its own monitor, so a turn already holding it is never cut off; a turn
     * still waiting for it sees the session marked evicted. Returns how many were removed.
     */
    public int evictIdle(Duration idleTimeout) {
        Instant cutoff = Instant.now().minus(idleTimeout);
        AtomicInteger count = new AtomicInteger();
        sessions.forEach((id, session) -> {
            synchronized (session) {
                if (session.getLastAccess().isBefore(cutoff) && sessions.remove(id, session)) {
                    session.markEvicted();
                    count.incrementAndGet();
                }
            }
        });
        int removed = count.get();
        if (removed > 0) {
            log.info("Evicted {} idle sessions, {} remain", removed, sessions.size());
        }
        return removed;
    }

    private static String key(String sessionId) {
        return StringUtils.isBlank(sessionId) ? DEFAULT_SESSION_ID : sessionId.trim();
    }
}
