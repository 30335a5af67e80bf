package com.hdltree.forest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The Earley items ending at one input position.
 *
 * An item is packed into a long as {@code production(24) | dot(8) | origin(32)}.
 */
final class ItemSet {

    private static final int[] NONE = new int[0];

    private long[] items = new long[16];
    private int size;
    private final Set<Long> seen = new HashSet<>();
    private final Map<Integer, List<Long>> waiting = new HashMap<>();
    private final Set<Integer> predicted = new HashSet<>();
    private final Map<Integer, TreeSet<Integer>> completed = new HashMap<>();

    static long item(int production, int dot, int origin) {
        return ((long) production << 40) | ((long) dot << 32) | (origin & 0xFFFFFFFFL);
    }

    static int production(long item) {
        return (int) (item >>> 40);
    }

    static int dot(long item) {
        return (int) ((item >>> 32) & 0xFF);
    }

    static int origin(long item) {
        return (int) item;
    }

    boolean add(long item) {
        if (!seen.add(item)) {
            return false;
        }
        if (size == items.length) {
            items = Arrays.copyOf(items, size * 2);
        }
        items[size++] = item;
        return true;
    }

    boolean contains(long item) {
        return seen.contains(item);
    }

    long get(int index) {
        return items[index];
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    /**
     * Records an item whose next symbol is {@code symbol}.
     *
     * @return true the first time {@code symbol} is awaited here, when it must be predicted
     */
    boolean await(int symbol, long item) {
        waiting.computeIfAbsent(symbol, s -> new ArrayList<>()).add(item);
        return predicted.add(symbol);
    }

    List<Long> waitingOn(int symbol) {
        return waiting.getOrDefault(symbol, List.of());
    }

    Set<Integer> awaitedSymbols() {
        return waiting.keySet();
    }

    void complete(int symbol, int origin) {
        completed.computeIfAbsent(symbol, s -> new TreeSet<>()).add(origin);
    }

    /**
     * Origins, in ascending order, of every completed recognition of {@code symbol} here.
     */
    int[] completedOrigins(int symbol) {
        TreeSet<Integer> origins = completed.get(symbol);
        if (origins == null) {
            return NONE;
        }
        return origins.stream().mapToInt(Integer::intValue).toArray();
    }
}
