package com.ai.supportdesk.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class FaqEntry {

    private final String category;

    private final List<String> keywords;

    private final String response;
}
