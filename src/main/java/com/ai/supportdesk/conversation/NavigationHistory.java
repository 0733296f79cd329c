package com.ai.supportdesk.conversation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded trail of visited dialogue node ids. When full, the oldest entry is dropped
 * to make room for the newest.
 */
public class NavigationHistory {

    public static final int DEFAULT_MAX_DEPTH = 10;

    private final Deque<String> stack = new ArrayDeque<>();
    private final int maxDepth;

    public NavigationHistory() {
        this(DEFAULT_MAX_DEPTH);
    }

    public NavigationHistory(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public void push(String nodeId) {
        if (stack.size() >= maxDepth) {
            stack.removeLast();
        }
        stack.push(nodeId);
    }

    /** Removes and returns the newest entry, or null when empty. */
    public String pop() {
        return stack.poll();
    }

    /** Newest entry, or null when empty. */
    public String peek() {
        return stack.peek();
    }

    public int size() {
        return stack.size();
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public void clear() {
        stack.clear();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /** Entries from oldest to newest. */
    public List<String> snapshot() {
        List<String> out = new ArrayList<>(stack.size());
        Iterator<String> it = stack.descendingIterator();
        while (it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }
}
