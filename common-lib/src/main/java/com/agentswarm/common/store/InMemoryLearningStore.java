package com.agentswarm.common.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Heap-backed {@link LearningStore}. Used by tests and when no data directory is
 * configured; contents are lost on restart.
 */
public class InMemoryLearningStore<T> implements LearningStore<T> {

    private final String              name;
    private final Function<T, String> keyExtractor;
    private final boolean             uniqueKeys;
    private final List<T>             records = new ArrayList<>();

    public InMemoryLearningStore(String name, Function<T, String> keyExtractor, boolean uniqueKeys) {
        this.name = name;
        this.keyExtractor = keyExtractor;
        this.uniqueKeys = uniqueKeys;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized boolean append(T record) {
        Objects.requireNonNull(record, "record");
        if (uniqueKeys && latest(keyExtractor.apply(record)).isPresent()) {
            return false;
        }
        records.add(record);
        return true;
    }

    @Override
    public synchronized List<T> query(Predicate<? super T> filter) {
        return records.stream().filter(filter).collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<T> latest(String key) {
        for (int i = records.size() - 1; i >= 0; i--) {
            T record = records.get(i);
            if (Objects.equals(keyExtractor.apply(record), key)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized T update(String key, Function<Optional<T>, T> fn) {
        T next = Objects.requireNonNull(fn.apply(latest(key)), "update result");
        records.removeIf(record -> Objects.equals(keyExtractor.apply(record), key));
        records.add(next);
        return next;
    }
}
