package com.agentswarm.orchestrator.session;

import com.agentswarm.common.trace.TraceContextUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * One JSON file per execution under the sessions directory, named
 * {@code swarm_session_<executionId>.json}.
 *
 * <p>Writes go to a temp file first and are moved into place atomically. Session files
 * are diagnostics: a failed write is logged and never interrupts the hop loop.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    static final String FILE_PREFIX = "swarm_session_";
    static final String FILE_SUFFIX = ".json";

    private final Path         directory;
    private final Duration     retention;
    private final ObjectMapper objectMapper;
    private final Clock        clock;

    public SessionStore(Path directory, Duration retention, ObjectMapper objectMapper, Clock clock) {
        this.directory = directory;
        this.retention = retention;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path pathFor(String executionId) {
        return directory.resolve(FILE_PREFIX + executionId + FILE_SUFFIX);
    }

    public void save(SwarmSession session) {
        Path target = pathFor(session.getExecutionId());
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, FILE_PREFIX, ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), session);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            TraceContextUtil.withMdc(session.getExecutionId(), () ->
                log.warn("[SessionStore] write failed path={} reason={}", target, e.getMessage()));
        }
    }

    public Optional<SwarmSession> load(String executionId) {
        Path path = pathFor(executionId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), SwarmSession.class));
        } catch (IOException e) {
            log.warn("[SessionStore] read failed path={} reason={}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Deletes session files last modified more than the retention period ago.
     *
     * @return number of files removed
     */
    public int cleanupExpired() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        Files.deleteIfExists(file);
                        removed++;
                    }
                } catch (IOException e) {
                    log.warn("[SessionStore] cleanup skipped path={} reason={}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("[SessionStore] cleanup failed dir={} reason={}", directory, e.getMessage());
        }
        if (removed > 0) {
            log.info("[SessionStore] expired sessions removed count={} retention={}", removed, retention);
        }
        return removed;
    }
}
