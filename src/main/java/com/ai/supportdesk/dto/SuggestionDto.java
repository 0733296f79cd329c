package com.ai.supportdesk.dto;

import com.ai.supportdesk.conversation.SuggestionEdge;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionDto {

    private String label;

    private String target;

    private double weight;

    public static SuggestionDto from(SuggestionEdge edge) {
        return new SuggestionDto(edge.getLabel(), edge.getTargetId(), edge.getWeight());
    }
}
