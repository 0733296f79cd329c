package com.ai.supportdesk.conversation;

import java.time.Instant;

/**
 * Per-session conversation state: the current dialogue node and the navigation trail
 * leading to it. The trail's newest entry is the current node.
 * <p>
 * Not thread-safe on its own; callers hold the session's monitor for a whole turn.
 */
public class SessionState {

    private final String sessionId;
    private final String rootId;
    private final NavigationHistory history;
    private String currentNodeId;
    private volatile Instant lastAccess = Instant.now();
    private volatile boolean evicted;
    private long turnCount;

    public SessionState(String sessionId, String rootId, int maxHistoryDepth) {
        this.sessionId = sessionId;
        this.rootId = rootId;
        this.history = new NavigationHistory(maxHistoryDepth);
        reset();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRootId() {
        return rootId;
    }

    public String getCurrentNodeId() {
        return currentNodeId;
    }

    public NavigationHistory getHistory() {
        return history;
    }

    public boolean isAtRoot() {
        return rootId.equals(currentNodeId);
    }

    /** Moves to {@code nodeId} and records it on the trail. */
    public void moveTo(String nodeId) {
        history.push(nodeId);
        currentNodeId = nodeId;
    }

    /** Sets the current node without touching the trail. */
    public void setCurrentNodeId(String currentNodeId) {
        this.currentNodeId = currentNodeId;
    }

    /** Back to the root with a trail of just the root. */
    public void reset() {
        history.clear();
        history.push(rootId);
        currentNodeId = rootId;
    }

    public Instant getLastAccess() {
        return lastAccess;
    }

    public long getTurnCount() {
        return turnCount;
    }

    public void touch() {
        lastAccess = Instant.now();
        turnCount++;
    }

    /** True once the store has dropped this session; a turn holding it must start over. */
    public boolean isEvicted() {
        return evicted;
    }

    public void markEvicted() {
        evicted = true;
    }
}
