package com.ai.supportdesk.conversation;

import java.util.Objects;

/**
 * One keyword-triggered transition out of a dialogue node.
 */
public final class DialogueOption {

    private final String keyword;
    private final String targetId;

    public DialogueOption(String keyword, String targetId) {
        this.keyword = Objects.requireNonNull(keyword, "keyword").trim().toLowerCase();
        this.targetId = Objects.requireNonNull(targetId, "targetId").trim();
    }

    public String getKeyword() {
        return keyword;
    }

    public String getTargetId() {
        return targetId;
    }

    /** Two-way containment: the keyword occurs in the input, or the input occurs in the keyword. */
    public boolean matches(String normalizedInput) {
        return normalizedInput.contains(keyword) || keyword.contains(normalizedInput);
    }

    @Override
    public String toString() {
        return keyword + "->" + targetId;
    }
}
