package org.calista.specopt.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO — single I/O entry point for checkpoints, feedback and training logs.
 *
 * <ul>
 *   <li>every relative path is resolved inside {@code baseDir} (no traversal through "..")</li>
 *   <li>whole-file writes go to a fsync'ed temp sibling committed with an atomic move,
 *       so a crash never leaves a half-written checkpoint</li>
 *   <li>JSONL appends hold an exclusive file lock (several trainers appending one log)</li>
 * </ul>
 * All text is UTF-8.
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private static final long APPEND_LOCK_TIMEOUT_NS = 3_000_000_000L;

    private final Path baseDir;

    public FileIO(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        log.debug("FileIO init: baseDir={}", this.baseDir);
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create base directory " + this.baseDir, e);
        }
    }

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and escapes via ".." are rejected.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("Absolute path not allowed here: " + relative);

        Path p = baseDir.resolve(rel).normalize();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path escapes base dir: " + relative);
        return p;
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    // ----------------------------
    // Whole-file text
    // ----------------------------

    public String readString(Path file) throws IOException {
        return Files.readString(Objects.requireNonNull(file, "file"), StandardCharsets.UTF_8);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        if (!exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(jsonLine, "jsonLine");
        String line = jsonLine.trim();
        if (line.isEmpty()) return;
        if (line.indexOf('\n') >= 0) throw new IllegalArgumentException("JSONL record spans several lines: " + file);
        ensureParentDir(file);

        String payload = line + System.lineSeparator();
        withAppendLock(file, ch -> ch.write(StandardCharsets.UTF_8.encode(payload)));
    }

    /** Trimmed, non-empty lines; empty when the file does not exist. */
    public List<String> readJsonl(Path file) throws IOException {
        if (!exists(file)) return List.of();
        try (Stream<String> s = Files.lines(file, StandardCharsets.UTF_8)) {
            return s.map(String::trim)
                    .filter(x -> !x.isEmpty())
                    .collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static void ensureParentDir(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        force(tmp);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {}", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("atomic move unsupported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void force(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.force(true);
        }
    }

    private static void withAppendLock(Path file, ChannelAction action) throws IOException {
        long deadlineNs = System.nanoTime() + APPEND_LOCK_TIMEOUT_NS;

        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            while (true) {
                FileLock lock = tryLock(ch);
                if (lock != null) {
                    try (lock) {
                        action.run(ch);
                        ch.force(false);
                        return;
                    }
                }
                if (System.nanoTime() >= deadlineNs) {
                    throw new IOException("Append lock timeout for " + file);
                }
                try {
                    Thread.sleep(10);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while waiting for append lock on " + file, ie);
                }
            }
        }
    }

    private static FileLock tryLock(FileChannel ch) throws IOException {
        try {
            return ch.tryLock();
        } catch (OverlappingFileLockException sameJvm) {
            // another thread of this JVM holds it: retry
            return null;
        }
    }

    @FunctionalInterface
    private interface ChannelAction {
        void run(FileChannel ch) throws IOException;
    }
}
