package com.agentswarm.orchestrator.store;

import com.agentswarm.common.exception.LearningStoreUnavailableException;
import com.agentswarm.common.store.LearningStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * {@link LearningStore} persisted as one JSON document per line.
 *
 * <p>Every operation runs under an in-process lock and an exclusive {@link FileLock} on a
 * sibling {@code .lock} file, so a read-modify-write from {@link #update} cannot lose a
 * concurrent write from this or another process. {@link #append} adds a line;
 * {@link #update} rewrites the file through a temp file and an atomic move, keeping one
 * line for the updated key. Lines that fail to parse are skipped with a WARN log and are
 * not carried over by a rewrite. Any I/O failure surfaces as
 * {@link LearningStoreUnavailableException}.
 */
public class JsonLinesLearningStore<T> implements LearningStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesLearningStore.class);

    private final String              name;
    private final Path                file;
    private final Path                lockFile;
    private final Class<T>            type;
    private final Function<T, String> keyExtractor;
    private final boolean             uniqueKeys;
    private final ObjectMapper        objectMapper;
    private final ReentrantLock       lock = new ReentrantLock();

    public JsonLinesLearningStore(String name, Path file, Class<T> type, Function<T, String> keyExtractor,
                                  boolean uniqueKeys, ObjectMapper objectMapper) {
        this.name = name;
        this.file = file;
        this.lockFile = file.resolveSibling(file.getFileName() + ".lock");
        this.type = type;
        this.keyExtractor = keyExtractor;
        this.uniqueKeys = uniqueKeys;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean append(T record) {
        Objects.requireNonNull(record, "record");
        return locked(() -> {
            if (uniqueKeys) {
                String key = keyExtractor.apply(record);
                if (readAll().stream().anyMatch(r -> Objects.equals(keyExtractor.apply(r), key))) {
                    return false;
                }
            }
            write(record);
            return true;
        });
    }

    @Override
    public List<T> query(Predicate<? super T> filter) {
        return locked(() -> readAll().stream().filter(filter).collect(Collectors.toList()));
    }

    @Override
    public Optional<T> latest(String key) {
        return locked(() -> newest(readAll(), key));
    }

    @Override
    public T update(String key, Function<Optional<T>, T> fn) {
        return locked(() -> {
            List<T> records = readAll();
            T next = Objects.requireNonNull(fn.apply(newest(records, key)), "update result");
            List<T> kept = records.stream()
                .filter(r -> !Objects.equals(keyExtractor.apply(r), key))
                .collect(Collectors.toCollection(ArrayList::new));
            kept.add(next);
            rewrite(kept);
            return next;
        });
    }

    private Optional<T> newest(List<T> records, String key) {
        for (int i = records.size() - 1; i >= 0; i--) {
            if (Objects.equals(keyExtractor.apply(records.get(i)), key)) {
                return Optional.of(records.get(i));
            }
        }
        return Optional.empty();
    }

    private List<T> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<T> records = new ArrayList<>();
        int lineNo = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                log.warn("[LearningStore] skipping unparseable line store={} line={} reason={}",
                         name, lineNo, e.getOriginalMessage());
            }
        }
        return records;
    }

    private void write(T record) throws IOException {
        String line = objectMapper.writeValueAsString(record) + "\n";
        Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private void rewrite(List<T> records) throws IOException {
        StringBuilder content = new StringBuilder();
        for (T record : records) {
            content.append(objectMapper.writeValueAsString(record)).append('\n');
        }
        Path parent = file.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private <R> R locked(IoAction<R> action) {
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } catch (IOException e) {
            throw new LearningStoreUnavailableException(name, "I/O failure on " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @FunctionalInterface
    private interface IoAction<R> {
        R run() throws IOException;
    }
}
