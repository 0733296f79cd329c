package com.ai.supportdesk.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Character tree over the auto-complete vocabulary. Lookups walk the lowercased prefix
 * and then collect terminal phrases depth-first, children in ascending character order,
 * so results are reproducible across runs.
 */
public class PrefixIndex {

    public static final int DEFAULT_MIN_PREFIX_LENGTH = 2;

    private final Node root = new Node();
    private final int minPrefixLength;
    private int phraseCount;

    public PrefixIndex() {
        this(DEFAULT_MIN_PREFIX_LENGTH);
    }

    public PrefixIndex(int minPrefixLength) {
        this.minPrefixLength = Math.max(1, minPrefixLength);
    }

    /**
     * Adds a phrase. The path is keyed by the lowercased phrase; the terminal node keeps
     * the phrase as given. Re-inserting an existing phrase keeps the first spelling.
     */
    public void insert(String phrase) {
        if (StringUtils.isBlank(phrase)) return;
        String original = phrase.trim();
        Node node = root;
        for (char c : original.toLowerCase().toCharArray()) {
            node = node.children.computeIfAbsent(c, key -> new Node());
        }
        if (node.phrase == null) {
            node.phrase = original;
            phraseCount++;
        }
    }

    /**
     * All stored phrases starting with {@code prefix}, at most {@code limit} of them.
     * Empty when the prefix is shorter than the minimum length or matches nothing.
     */
    public List<String> suggestions(String prefix, int limit) {
        if (prefix == null || limit < 1) return Collections.emptyList();
        String key = prefix.trim().toLowerCase();
        if (key.length() < minPrefixLength) return Collections.emptyList();

        Node node = find(key);
        if (node == null) return Collections.emptyList();

        List<String> out = new ArrayList<>(Math.min(limit, 16));
        collect(node, out, limit);
        return out;
    }

    public boolean contains(String phrase) {
        if (StringUtils.isBlank(phrase)) return false;
        Node node = find(phrase.trim().toLowerCase());
        return node != null && node.phrase != null;
    }

    public int size() {
        return phraseCount;
    }

    public int getMinPrefixLength() {
        return minPrefixLength;
    }

    private Node find(String key) {
        Node node = root;
        for (int i = 0; i < key.length() && node != null; i++) {
            node = node.children.get(key.charAt(i));
        }
        return node;
    }

    private static void collect(Node node, List<String> out, int limit) {
        if (out.size() >= limit) return;
        if (node.phrase != null) {
            out.add(node.phrase);
        }
        for (Node child : node.children.values()) {
            if (out.size() >= limit) return;
            collect(child, out, limit);
        }
    }

    private static final class Node {
        private final Map<Character, Node> children = new TreeMap<>();
        private String phrase;
    }
}
