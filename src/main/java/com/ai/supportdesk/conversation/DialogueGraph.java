package com.ai.supportdesk.conversation;

import com.ai.supportdesk.exception.ContentConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of dialogue nodes with a distinguished root. Built once at start-up and
 * shared by every session.
 */
public final class DialogueGraph {

    private static final Logger log = LoggerFactory.getLogger(DialogueGraph.class);

    public static final String DEFAULT_ROOT_ID = "root";

    private final String rootId;
    private final Map<String, DialogueNode> nodes;

    private DialogueGraph(String rootId, Map<String, DialogueNode> nodes) {
        this.rootId = rootId;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public static Builder builder() {
        return new Builder(DEFAULT_ROOT_ID);
    }

    public static Builder builder(String rootId) {
        return new Builder(rootId);
    }

    public String getRootId() {
        return rootId;
    }

    public DialogueNode root() {
        return nodes.get(rootId);
    }

    public Optional<DialogueNode> node(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    public static final class Builder {

        private final String rootId;
        private final Map<String, DialogueNode> nodes = new LinkedHashMap<>();

        private Builder(String rootId) {
            if (StringUtils.isBlank(rootId)) {
                throw new ContentConfigurationException("Dialogue root id must not be blank");
            }
            this.rootId = rootId.trim();
        }

        public Builder node(String id, String prompt, boolean leaf, List<DialogueOption> options) {
            if (StringUtils.isBlank(id)) {
                throw new ContentConfigurationException("Dialogue node id must not be blank");
            }
            String key = id.trim();
            if (nodes.containsKey(key)) {
                throw new ContentConfigurationException("Duplicate dialogue node id: " + key);
            }
            List<DialogueOption> opts = options != null ? options : List.of();
            for (DialogueOption option : opts) {
                if (option.getKeyword().isEmpty() || option.getTargetId().isEmpty()) {
                    throw new ContentConfigurationException(
                            "Dialogue option on node '" + key + "' needs a keyword and a target");
                }
            }
            if (!leaf && opts.isEmpty()) {
                throw new ContentConfigurationException(
                        "Dialogue node '" + key + "' is not a leaf but has no options");
            }
            nodes.put(key, new DialogueNode(key, prompt, opts, leaf));
            return this;
        }

        /**
         * Validates and freezes the graph. A missing root, or a non-leaf node none of whose
         * options reaches a defined node, fails; single dangling targets and unreachable
         * nodes are logged and left in place.
         */
        public DialogueGraph build() {
            if (!nodes.containsKey(rootId)) {
                throw new ContentConfigurationException("Dialogue root node '" + rootId + "' is not defined");
            }
            for (DialogueNode node : nodes.values()) {
                boolean anyValid = false;
                for (DialogueOption option : node.getOptions()) {
                    if (nodes.containsKey(option.getTargetId())) {
                        anyValid = true;
                    } else {
                        log.warn("Dialogue node '{}' option '{}' targets unknown node '{}'; it will never match",
                                node.getId(), option.getKeyword(), option.getTargetId());
                    }
                }
                if (!node.isLeaf() && !anyValid) {
                    throw new ContentConfigurationException(
                            "Dialogue node '" + node.getId() + "' is not a leaf and has no option with a valid target");
                }
            }
            List<String> unreachable = unreachableFromRoot();
            if (!unreachable.isEmpty()) {
                log.warn("Dialogue nodes not reachable from '{}': {}", rootId, unreachable);
            }
            return new DialogueGraph(rootId, nodes);
        }

        private List<String> unreachableFromRoot() {
            Set<String> seen = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(rootId);
            seen.add(rootId);
            while (!queue.isEmpty()) {
                DialogueNode node = nodes.get(queue.poll());
                for (DialogueOption option : node.getOptions()) {
                    String target = option.getTargetId();
                    if (nodes.containsKey(target) && seen.add(target)) {
                        queue.add(target);
                    }
                }
            }
            List<String> out = new ArrayList<>();
            for (String id : nodes.keySet()) {
                if (!seen.contains(id)) out.add(id);
            }
            return out;
        }
    }
}
