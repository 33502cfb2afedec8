package org.calista.unglish.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * FileIO: the one place the project touches the file system.
 *
 * <p>Used for the application config, external language files and batch exports. The generator itself never
 * does I/O.</p>
 *
 * - relative paths resolve inside baseDir, ".." escapes are rejected
 * - writes go to a sibling temp file and are moved into place (atomic where the FS allows)
 * - unchanged content is not rewritten
 * - JSONL helpers for exports
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists", e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and traversal outside baseDir are rejected.
     * Backslashes are treated as separators.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /** Paths the user passes explicitly (config file, language file): normalization only. */
    public Path resolveExternal(Path anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        return anyPath.isAbsolute() ? anyPath.normalize() : baseDir.resolve(anyPath).normalize();
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (isSameContent(file, content)) {
            log.debug("writeString: skip unchanged content for {}", file);
            return;
        }
        if (!atomicWrites) {
            Files.writeString(file, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName().toString() + ".tmp");
        Files.writeString(tmp, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        commit(tmp, file);
    }

    // ----------------------------
    // JSONL helpers
    // ----------------------------

    /** Replaces the file with the given records, one per line, in a single commit. */
    public void writeJsonl(Path file, List<String> jsonLines) throws IOException {
        Objects.requireNonNull(jsonLines, "jsonLines");
        writeString(file, joinLines(jsonLines));
    }

    /** Adds records to the end of the file, creating it when missing. */
    public void appendJsonl(Path file, List<String> jsonLines) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(jsonLines, "jsonLines");
        String block = joinLines(jsonLines);
        if (block.isEmpty()) return;
        ensureParentDir(file);
        Files.writeString(file, block, charset, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static String joinLines(List<String> lines) {
        StringBuilder sb = new StringBuilder(lines.size() * 128);
        for (String line : lines) {
            if (line == null) continue;
            String s = line.trim();
            if (s.isEmpty()) continue;
            sb.append(s).append(System.lineSeparator());
        }
        return sb.toString();
    }

    private static void ensureParentDir(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static void commit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("commit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("commit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            // a failed move can leave tmp behind
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("Could not remove temp file {}: {}", tmp, e.toString());
            }
        }
    }

    private boolean isSameContent(Path file, String content) {
        if (!Files.exists(file)) return false;
        try {
            if (Files.size(file) != content.getBytes(charset).length) return false;
            return Files.readString(file, charset).equals(content);
        } catch (IOException e) {
            log.debug("Could not compare {} with new content, rewriting: {}", file, e.toString());
            return false;
        }
    }
}
