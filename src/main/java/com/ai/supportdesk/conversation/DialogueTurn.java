package com.ai.supportdesk.conversation;

import java.util.List;

/**
 * Result of advancing one session by one input.
 */
public final class DialogueTurn {

    public enum Outcome {
        /** An option matched and the session moved. */
        ADVANCED,
        /** Nothing matched; the session stayed put. */
        NO_MATCH,
        /** The back command moved the session to an earlier node. */
        WENT_BACK,
        /** The back command had nowhere to go. */
        AT_ROOT,
        /** The menu command returned the session to the root. */
        RESET
    }

    private final Outcome outcome;
    private final String replyText;
    private final DialogueNode node;

    public DialogueTurn(Outcome outcome, String replyText, DialogueNode node) {
        this.outcome = outcome;
        this.replyText = replyText;
        this.node = node;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getReplyText() {
        return replyText;
    }

    public String getNodeId() {
        return node.getId();
    }

    public boolean isLeaf() {
        return node.isLeaf();
    }

    public List<String> getAvailableOptions() {
        return node.getOptionKeywords();
    }

    public boolean isMatched() {
        return outcome != Outcome.NO_MATCH;
    }

    public boolean isNavigation() {
        return outcome == Outcome.WENT_BACK || outcome == Outcome.AT_ROOT || outcome == Outcome.RESET;
    }
}
