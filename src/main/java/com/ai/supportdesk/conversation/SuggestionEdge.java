package com.ai.supportdesk.conversation;

/**
 * Weighted next-action edge between two dialogue nodes. Weights are ranking scores only;
 * zero and negative values are allowed.
 */
public final class SuggestionEdge {

    private final String sourceId;
    private final String targetId;
    private final double weight;
    private final String label;

    public SuggestionEdge(String sourceId, String targetId, double weight, String label) {
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.weight = weight;
        this.label = label != null && !label.isBlank() ? label : targetId;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public double getWeight() {
        return weight;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return sourceId + " -(" + weight + ")-> " + targetId + " [" + label + "]";
    }
}
