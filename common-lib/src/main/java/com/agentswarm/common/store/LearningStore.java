package com.agentswarm.common.store;

import com.agentswarm.common.exception.LearningStoreUnavailableException;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Append-only, keyed record store feeding the adaptive controllers.
 *
 * <p>Every record has a key (task id, domain, action type) derived by the store's key
 * extractor. Records are returned in append order. A store created with unique keys
 * rejects a second record for an existing key; otherwise the newest record for a key
 * supersedes the older ones for {@link #latest}.
 *
 * <p>Every operation may throw {@link LearningStoreUnavailableException}; callers are
 * expected to catch it and fall back.
 *
 * @param <T> record type
 */
public interface LearningStore<T> {

    /** Short name used in logs and exception messages. */
    String name();

    /**
     * Appends {@code record}.
     *
     * @return {@code false} when the store enforces unique keys and the key already exists
     */
    boolean append(T record);

    /** All records matching {@code filter}, in append order. */
    List<T> query(Predicate<? super T> filter);

    /** Newest record stored under {@code key}. */
    Optional<T> latest(String key);

    /**
     * Atomically reads the newest record for {@code key}, applies {@code fn} and stores the
     * result as the only record under {@code key}, after all other records. No other write
     * to this store can interleave between the read and the write.
     *
     * @param fn receives the current newest record (empty when none) and returns the new one, never null
     * @return the stored record
     */
    T update(String key, Function<Optional<T>, T> fn);
}
