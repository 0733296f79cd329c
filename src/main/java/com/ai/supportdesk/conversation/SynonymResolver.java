package com.ai.supportdesk.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjoint-set over intent phrases with union by rank and path compression.
 * Every phrase maps to one canonical representative; unseen phrases are their own root.
 * <p>
 * While groups are being seeded, lookups relink visited entries, so every method takes the
 * resolver's monitor. After {@link #freeze()} the table is a read-only snapshot: lookups
 * are lock-free, unseen phrases are no longer registered and {@link #union} fails.
 */
public class SynonymResolver {

    private final Map<String, String> parent = new HashMap<>();
    private final Map<String, Integer> rank = new HashMap<>();
    private volatile Map<String, String> frozen;

    /**
     * Merges the groups of {@code a} and {@code b}. On equal rank the root of {@code b}
     * goes under the root of {@code a}. Returns the surviving root.
     */
    public synchronized String union(String a, String b) {
        if (frozen != null) {
            throw new IllegalStateException("Synonym groups are frozen");
        }
        String rootA = resolve(a);
        String rootB = resolve(b);
        if (rootA.equals(rootB)) return rootA;

        int rankA = rank.get(rootA);
        int rankB = rank.get(rootB);
        if (rankA < rankB) {
            parent.put(rootA, rootB);
            return rootB;
        }
        if (rankA > rankB) {
            parent.put(rootB, rootA);
            return rootA;
        }
        parent.put(rootB, rootA);
        rank.put(rootA, rankA + 1);
        return rootA;
    }

    /**
     * Canonical representative of {@code phrase}, registering it as a singleton if unseen.
     */
    public String resolve(String phrase) {
        Map<String, String> snapshot = frozen;
        if (snapshot != null) {
            String key = normalize(phrase);
            return snapshot.getOrDefault(key, key);
        }
        synchronized (this) {
            String key = normalize(phrase);
            if (!parent.containsKey(key)) {
                parent.put(key, key);
                rank.put(key, 0);
                return key;
            }
            return findRoot(key);
        }
    }

    /**
     * Same answer as {@link #resolve(String)} without registering unseen phrases.
     */
    public String canonicalOf(String phrase) {
        String key = normalize(phrase);
        Map<String, String> snapshot = frozen;
        if (snapshot != null) {
            return snapshot.getOrDefault(key, key);
        }
        synchronized (this) {
            return parent.containsKey(key) ? findRoot(key) : key;
        }
    }

    public boolean areEquivalent(String a, String b) {
        return resolve(a).equals(resolve(b));
    }

    public boolean isKnown(String phrase) {
        Map<String, String> snapshot = frozen;
        if (snapshot != null) {
            return snapshot.containsKey(normalize(phrase));
        }
        synchronized (this) {
            return parent.containsKey(normalize(phrase));
        }
    }

    public int size() {
        Map<String, String> snapshot = frozen;
        if (snapshot != null) {
            return snapshot.size();
        }
        synchronized (this) {
            return parent.size();
        }
    }

    /**
     * Compresses every path and publishes the phrase to representative table as an
     * immutable snapshot. Called once seeding is done.
     */
    public synchronized void freeze() {
        if (frozen != null) return;
        Map<String, String> snapshot = new HashMap<>();
        for (String key : new ArrayList<>(parent.keySet())) {
            snapshot.put(key, findRoot(key));
        }
        frozen = Map.copyOf(snapshot);
    }

    public boolean isFrozen() {
        return frozen != null;
    }

    private String findRoot(String key) {
        String root = key;
        List<String> visited = new ArrayList<>();
        while (!parent.get(root).equals(root)) {
            visited.add(root);
            root = parent.get(root);
        }
        for (String node : visited) {
            parent.put(node, root);
        }
        return root;
    }

    private static String normalize(String phrase) {
        return StringUtils.trimToEmpty(phrase).toLowerCase();
    }
}
