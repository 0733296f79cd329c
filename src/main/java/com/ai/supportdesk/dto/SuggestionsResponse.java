package com.ai.supportdesk.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class SuggestionsResponse {

    private final String prefix;

    private final List<String> suggestions;

    public int getCount() {
        return suggestions.size();
    }
}
