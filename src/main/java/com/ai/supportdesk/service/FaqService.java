package com.ai.supportdesk.service;

import com.ai.supportdesk.config.FaqEntry;
import com.ai.supportdesk.config.SupportContent;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword to canned-answer map. The whole intent is tried first, then each token in order.
 */
@Service
public class FaqService implements DirectAnswerLookup {

    private static final Logger log = LoggerFactory.getLogger(FaqService.class);

    private final Map<String, FaqEntry> byKeyword = new HashMap<>();
    private final int entryCount;

    public FaqService(SupportContent content) {
        Set<FaqEntry> distinct = new HashSet<>();
        for (FaqEntry entry : content.getFaqs()) {
            for (String keyword : entry.getKeywords()) {
                FaqEntry previous = byKeyword.put(keyword.trim().toLowerCase(), entry);
                if (previous != null && previous != entry) {
                    log.warn("FAQ keyword '{}' moved from '{}' to '{}'", keyword, previous.getCategory(), entry.getCategory());
                }
            }
            distinct.add(entry);
        }
        this.entryCount = distinct.size();
    }

    @Override
    public Optional<DirectAnswer> lookupDirectAnswer(String canonicalIntent) {
        String query = StringUtils.trimToEmpty(canonicalIntent).toLowerCase();
        if (query.isEmpty()) return Optional.empty();

        FaqEntry exact = byKeyword.get(query);
        if (exact != null) {
            return Optional.of(toAnswer(exact, query));
        }
        for (String token : StringUtils.split(query)) {
            FaqEntry entry = byKeyword.get(token);
            if (entry != null) {
                return Optional.of(toAnswer(entry, token));
            }
        }
        return Optional.empty();
    }

    @Override
    public int size() {
        return entryCount;
    }

    private static DirectAnswer toAnswer(FaqEntry entry, String keyword) {
        return new DirectAnswer(entry.getResponse(), entry.getCategory(), keyword);
    }
}
