package com.ai.supportdesk.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EngineStats {

    private final int vocabularyPhrases;

    private final int synonymPhrases;

    private final int faqEntries;

    private final int dialogueNodes;

    private final int suggestionEdges;

    private final int activeSessions;
}
