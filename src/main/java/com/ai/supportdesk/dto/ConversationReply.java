package com.ai.supportdesk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Reply to one submitted message: text to show, where the session now is, and the
 * ranked next actions for that node.
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationReply {

    public enum Source {
        INPUT_VALIDATION,
        FAQ,
        DIALOGUE,
        NAVIGATION
    }

    private final String replyText;

    private final String currentNodeId;

    @JsonProperty("isLeaf")
    private final boolean leaf;

    @Builder.Default
    private final List<SuggestionDto> suggestions = List.of();

    private final Source source;

    private final String canonicalIntent;

    private final boolean intentNormalized;

    /** False when the dialogue could not match the input. */
    private final boolean understood;

    private final String matchedKeyword;

    private final String category;

    @Builder.Default
    private final List<String> availableOptions = List.of();

    private final int historySize;
}
