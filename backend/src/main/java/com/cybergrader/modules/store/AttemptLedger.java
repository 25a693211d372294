package com.cybergrader.modules.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Append-only attempt history. Keeps every attempt per key and the global
 * insertion order. Not thread-safe; the owning store serialises access.
 */
public class AttemptLedger<K, A> {

    private final Map<K, List<A>> byKey = new HashMap<>();
    private final List<A> sequence = new ArrayList<>();

    public void append(K key, A attempt) {
        byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(attempt);
        sequence.add(attempt);
    }

    public boolean anyMatch(K key, Predicate<A> predicate) {
        return byKey.getOrDefault(key, List.of()).stream().anyMatch(predicate);
    }

    public List<A> filter(Predicate<A> predicate) {
        return sequence.stream().filter(predicate).toList();
    }

    public List<A> all() {
        return List.copyOf(sequence);
    }

    void clear() {
        byKey.clear();
        sequence.clear();
    }
}
