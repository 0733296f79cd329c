package com.ai.supportdesk.service;

import java.util.Optional;

/**
 * Source of canned answers consulted after synonym resolution and before the dialogue moves.
 */
public interface DirectAnswerLookup {

    Optional<DirectAnswer> lookupDirectAnswer(String canonicalIntent);

    int size();

    final class DirectAnswer {

        private final String text;
        private final String category;
        private final String matchedKeyword;

        public DirectAnswer(String text, String category, String matchedKeyword) {
            this.text = text;
            this.category = category;
            this.matchedKeyword = matchedKeyword;
        }

        public String getText() {
            return text;
        }

        public String getCategory() {
            return category;
        }

        public String getMatchedKeyword() {
            return matchedKeyword;
        }
    }
}
