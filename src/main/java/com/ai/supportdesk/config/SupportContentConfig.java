package com.ai.supportdesk.config;

import com.ai.supportdesk.conversation.DialogueGraph;
import com.ai.supportdesk.conversation.PrefixIndex;
import com.ai.supportdesk.conversation.SuggestionGraph;
import com.ai.supportdesk.conversation.SynonymResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.util.List;

/**
 * Builds the read-only conversation structures once at start-up. A bad content file
 * stops the context before any traffic is served.
 */
@Configuration
public class SupportContentConfig {

    private static final Logger log = LoggerFactory.getLogger(SupportContentConfig.class);

    @Bean
    SupportContent supportContent(ObjectMapper objectMapper,
                                  @Value("${support.content-location:classpath:support/content.json}") Resource location) {
        SupportContent content = new SupportContentLoader(objectMapper).load(location);
        warnOnUnknownSuggestionNodes(content);
        return content;
    }

    @Bean
    PrefixIndex prefixIndex(SupportContent content,
                            @Value("${support.autocomplete.min-prefix-length:2}") int minPrefixLength) {
        PrefixIndex index = new PrefixIndex(minPrefixLength);
        content.getVocabulary().forEach(index::insert);
        return index;
    }

    @Bean
    SynonymResolver synonymResolver(SupportContent content) {
        SynonymResolver resolver = new SynonymResolver();
        for (List<String> group : content.getSynonymGroups()) {
            String representative = group.get(0);
            for (String member : group.subList(1, group.size())) {
                resolver.union(representative, member);
            }
        }
        resolver.freeze();
        return resolver;
    }

    @Bean
    DialogueGraph dialogueGraph(SupportContent content) {
        return content.getDialogue();
    }

    @Bean
    SuggestionGraph suggestionGraph(SupportContent content) {
        return content.getSuggestions();
    }

    private static void warnOnUnknownSuggestionNodes(SupportContent content) {
        DialogueGraph dialogue = content.getDialogue();
        for (String id : content.getSuggestions().nodeIds()) {
            if (!dialogue.contains(id)) {
                log.warn("Suggestion graph refers to node '{}' which is not in the dialogue", id);
            }
        }
    }
}
