package com.ai.supportdesk.service;

import com.ai.supportdesk.conversation.IntentResolution;
import com.ai.supportdesk.conversation.SynonymResolver;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Maps a message to its canonical intent: the whole message first, then the first
 * whitespace token that belongs to a synonym group with a different representative.
 */
@Service
public class IntentNormalizer {

    private final SynonymResolver synonyms;

    public IntentNormalizer(SynonymResolver synonyms) {
        this.synonyms = synonyms;
    }

    public IntentResolution normalize(String message) {
        String lowered = StringUtils.trimToEmpty(message).toLowerCase();
        if (lowered.isEmpty()) {
            return new IntentResolution(message, lowered, false);
        }

        String canonical = synonyms.canonicalOf(lowered);
        for (String token : StringUtils.split(lowered)) {
            String tokenCanonical = synonyms.canonicalOf(token);
            if (!tokenCanonical.equals(token)) {
                canonical = tokenCanonical;
                break;
            }
        }
        return new IntentResolution(message, canonical, !canonical.equals(lowered));
    }
}
