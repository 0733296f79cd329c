package com.ai.supportdesk.service;

import com.ai.supportdesk.config.FaqEntry;
import com.ai.supportdesk.config.SupportContent;
import com.ai.supportdesk.conversation.DialogueGraph;
import com.ai.supportdesk.conversation.SuggestionGraph;
import com.ai.supportdesk.service.DirectAnswerLookup.DirectAnswer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FaqServiceTest {

    private FaqService faqService;

    @BeforeEach
    void setUp() {
        SupportContent content = SupportContent.builder()
                .faq(new FaqEntry("shipping", List.of("shipping", "delivery time"), "Ships in 5-7 days"))
                .faq(new FaqEntry("hours", List.of("Hours", "open"), "Open 9 to 9"))
                .dialogue(DialogueGraph.builder().node("root", "Welcome", true, List.of()).build())
                .suggestions(SuggestionGraph.builder().build())
                .build();
        faqService = new FaqService(content);
    }

    @Test
    void exactIntentMatchWins() {
        Optional<DirectAnswer> answer = faqService.lookupDirectAnswer("Delivery Time");

        assertThat(answer).isPresent();
        assertThat(answer.get().getCategory()).isEqualTo("shipping");
        assertThat(answer.get().getMatchedKeyword()).isEqualTo("delivery time");
    }

    @Test
    void firstMatchingTokenIsUsed() {
        Optional<DirectAnswer> answer = faqService.lookupDirectAnswer("what are your hours for shipping");

        assertThat(answer).map(DirectAnswer::getText).contains("Open 9 to 9");
    }

    @Test
    void noKeywordMeansNoAnswer() {
        assertThat(faqService.lookupDirectAnswer("track")).isEmpty();
        assertThat(faqService.lookupDirectAnswer("")).isEmpty();
        assertThat(faqService.lookupDirectAnswer(null)).isEmpty();
    }

    @Test
    void sizeCountsEntriesNotKeywords() {
        assertThat(faqService.size()).isEqualTo(2);
    }
}
