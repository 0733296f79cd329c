package com.ai.supportdesk.config;

import com.ai.supportdesk.conversation.DialogueGraph;
import com.ai.supportdesk.conversation.SuggestionGraph;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Everything read from the content file, already validated.
 */
@Getter
@Builder
public class SupportContent {

    @Singular("phrase")
    private final List<String> vocabulary;

    /** Synonym groups in file order; the first member of each group is its representative. */
    @Singular
    private final List<List<String>> synonymGroups;

    @Singular("faq")
    private final List<FaqEntry> faqs;

    private final DialogueGraph dialogue;

    private final SuggestionGraph suggestions;
}
