package com.ai.supportdesk.scheduler;

import com.ai.supportdesk.service.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Removes sessions nobody has written to within the idle timeout.
 */
@Component
public class SessionReaperScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionReaperScheduler.class);

    private final SessionStore sessionStore;
    private final Duration idleTimeout;

    public SessionReaperScheduler(SessionStore sessionStore,
                                  @Value("${support.sessions.idle-timeout:30m}") Duration idleTimeout) {
        this.sessionStore = sessionStore;
        this.idleTimeout = idleTimeout;
    }

    @Scheduled(fixedDelayString = "${support.sessions.sweep-interval:60000}")
    public void evictIdleSessions() {
        try {
            sessionStore.evictIdle(idleTimeout);
        } catch (Exception e) {
            log.error("Idle session sweep failed: {}", e.getMessage(), e);
        }
    }
}
