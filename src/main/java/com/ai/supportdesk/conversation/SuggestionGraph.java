package com.ai.supportdesk.conversation;

import com.ai.supportdesk.exception.ContentConfigurationException;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static weighted adjacency of node id to outgoing next-action edges. Edges of a source
 * keep insertion order, which breaks ties between equal weights.
 */
public final class SuggestionGraph {

    private static final Comparator<SuggestionEdge> BY_WEIGHT_DESC =
            Comparator.comparingDouble(SuggestionEdge::getWeight).reversed();

    private final Map<String, List<SuggestionEdge>> adjacency;
    private final int edgeCount;

    private SuggestionGraph(Map<String, List<SuggestionEdge>> adjacency) {
        Map<String, List<SuggestionEdge>> copy = new LinkedHashMap<>();
        int count = 0;
        for (Map.Entry<String, List<SuggestionEdge>> e : adjacency.entrySet()) {
            copy.put(e.getKey(), List.copyOf(e.getValue()));
            count += e.getValue().size();
        }
        this.adjacency = Collections.unmodifiableMap(copy);
        this.edgeCount = count;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Highest-weight edges out of {@code nodeId}, at most {@code topK}. List.sort is stable,
     * so equal weights stay in insertion order.
     */
    public List<SuggestionEdge> suggestions(String nodeId, int topK) {
        if (nodeId == null || topK < 1) return Collections.emptyList();
        List<SuggestionEdge> edges = adjacency.get(nodeId);
        if (edges == null || edges.isEmpty()) return Collections.emptyList();

        List<SuggestionEdge> sorted = new ArrayList<>(edges);
        sorted.sort(BY_WEIGHT_DESC);
        return sorted.size() > topK ? List.copyOf(sorted.subList(0, topK)) : List.copyOf(sorted);
    }

    public List<SuggestionEdge> edges(String nodeId) {
        return adjacency.getOrDefault(nodeId, Collections.emptyList());
    }

    public Set<String> nodeIds() {
        Set<String> ids = new LinkedHashSet<>(adjacency.keySet());
        adjacency.values().forEach(list -> list.forEach(e -> ids.add(e.getTargetId())));
        return ids;
    }

    public int nodeCount() {
        return nodeIds().size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public List<String> sources() {
        return List.copyOf(adjacency.keySet());
    }

    public static final class Builder {

        private final Map<String, List<SuggestionEdge>> adjacency = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder edge(String sourceId, String targetId, double weight, String label) {
            if (StringUtils.isAnyBlank(sourceId, targetId)) {
                throw new ContentConfigurationException("Suggestion edge needs a source and a target");
            }
            if (Double.isNaN(weight) || Double.isInfinite(weight)) {
                throw new ContentConfigurationException(
                        "Suggestion edge " + sourceId + " -> " + targetId + " has a non-finite weight");
            }
            String source = sourceId.trim();
            adjacency.computeIfAbsent(source, key -> new ArrayList<>())
                    .add(new SuggestionEdge(source, targetId.trim(), weight, label));
            return this;
        }

        public SuggestionGraph build() {
            return new SuggestionGraph(adjacency);
        }
    }
}
