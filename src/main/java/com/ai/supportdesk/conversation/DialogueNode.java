package com.ai.supportdesk.conversation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One state of the conversation. Options keep their configured order; the first match wins.
 */
public final class DialogueNode {

    private final String id;
    private final String prompt;
    private final List<DialogueOption> options;
    private final boolean leaf;

    public DialogueNode(String id, String prompt, List<DialogueOption> options, boolean leaf) {
        this.id = id;
        this.prompt = prompt != null ? prompt : "";
        this.options = options != null ? List.copyOf(options) : List.of();
        this.leaf = leaf;
    }

    public String getId() {
        return id;
    }

    public String getPrompt() {
        return prompt;
    }

    public List<DialogueOption> getOptions() {
        return options;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public List<String> getOptionKeywords() {
        return options.stream().map(DialogueOption::getKeyword).collect(Collectors.toList());
    }
}
