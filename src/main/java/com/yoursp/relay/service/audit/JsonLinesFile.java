package com.yoursp.relay.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Append-only file of JSON objects, one per line.
 * <p>
 * Appends and rewrites hold a per-path {@link ReentrantLock} inside the JVM
 * and an exclusive {@link FileLock} on a {@code <file>.lock} sidecar across
 * processes, so the HTTP service and the integrity batch never interleave
 * partial lines. Rewrites go to a temp file that is atomically moved over the
 * original.
 * </p>
 */
@Slf4j
public class JsonLinesFile {

    private static final ConcurrentMap<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final Path path;
    private final Path lockPath;
    private final ObjectMapper objectMapper;

    public JsonLinesFile(Path path, ObjectMapper objectMapper) {
        this.path = path.toAbsolutePath().normalize();
        this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
        this.objectMapper = objectMapper;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Serialize {@code record} and append it as a single line.
     */
    public void append(Object record) throws IOException {
        byte[] line = (objectMapper.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
        withExclusiveLock(() -> {
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
            return null;
        });
    }

    /**
     * Parse every line as {@code type}. A missing file reads as empty;
     * unparseable lines are skipped with a warning.
     */
    public <T> List<T> readAll(Class<T> type) throws IOException {
        List<T> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                T record = parse(line, lineNumber, type);
                if (record != null) {
                    records.add(record);
                }
            }
        } catch (NoSuchFileException e) {
            log.debug("{} does not exist yet", path);
        }
        return records;
    }

    /**
     * First record, top to bottom, matching {@code filter}.
     */
    public <T> Optional<T> findFirst(Class<T> type, Predicate<T> filter) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                T record = parse(line, lineNumber, type);
                if (record != null && filter.test(record)) {
                    return Optional.of(record);
                }
            }
        } catch (NoSuchFileException e) {
            log.debug("{} does not exist yet", path);
        }
        return Optional.empty();
    }

    /**
     * Keep only the newest {@code keep} lines, in their original order.
     *
     * @return number of lines dropped
     */
    public int retainLast(int keep) throws IOException {
        if (keep < 0) {
            throw new IllegalArgumentException("keep must be >= 0, got " + keep);
        }
        return withExclusiveLock(() -> {
            if (!Files.exists(path)) {
                return 0;
            }
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            if (lines.size() <= keep) {
                return 0;
            }
            List<String> tail = lines.subList(lines.size() - keep, lines.size());
            Path tmp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
            try {
                Files.write(tmp, tail, StandardCharsets.UTF_8);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            return lines.size() - keep;
        });
    }

    private <T> T parse(String line, int lineNumber, Class<T> type) {
        if (line.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(line, type);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed line {} in {}: {}", lineNumber, path, e.getOriginalMessage());
            return null;
        }
    }

    private <R> R withExclusiveLock(IoAction<R> action) throws IOException {
        ReentrantLock lock = LOCKS.computeIfAbsent(path, p -> new ReentrantLock());
        lock.lock();
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel lockChannel = FileChannel.open(lockPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE);
                    FileLock ignored = lockChannel.lock()) {
                return action.run();
            }
        } finally {
            lock.unlock();
        }
    }

    @FunctionalInterface
    private interface IoAction<R> {
        R run() throws IOException;
    }
}
