package org.calista.neuro.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Objects;

/**
 * FileIO: файлы конфига и весов модели под одним baseDir.
 *
 * <ul>
 *   <li>{@link #resolve(String)} не выпускает относительный путь за пределы baseDir</li>
 *   <li>запись через tmp-файл рядом и ATOMIC_MOVE (обычный move, если ФС не умеет)</li>
 *   <li>одинаковое содержимое повторно не пишется</li>
 * </ul>
 *
 * Absolute paths go to the read/write methods unchanged.
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    /** Creates {@code baseDir} if it is missing. */
    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create base directory " + this.baseDir, e);
        }
        log.debug("FileIO on {} (charset={}, atomic={})", this.baseDir, charset, atomicWrites);
    }

    public Path baseDir() {
        return baseDir;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Path.of(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("Expected a relative path: " + relative);

        Path p = baseDir.resolve(rel).normalize();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path escapes " + baseDir + ": " + relative);
        return p;
    }

    /** Model paths from config may be absolute; relative ones are kept inside baseDir. */
    public Path resolveAny(Path path) {
        Objects.requireNonNull(path, "path");
        return path.isAbsolute() ? path.normalize() : resolve(path.toString());
    }

    // ----- text (config) -----

    public String readString(Path file) throws IOException {
        return Files.readString(Objects.requireNonNull(file, "file"), charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(content, "content");
        writeBytes(file, content.getBytes(charset));
    }

    // ----- bytes (weights) -----

    public byte[] readBytes(Path file) throws IOException {
        return Files.readAllBytes(Objects.requireNonNull(file, "file"));
    }

    public void writeBytes(Path file, byte[] bytes) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(bytes, "bytes");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);

        if (unchanged(file, bytes)) {
            log.debug("{} unchanged, write skipped", file);
            return;
        }
        if (!atomicWrites) {
            Files.write(file, bytes);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.trace("atomic move unsupported for {}, plain replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            // left behind only when the move failed
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("Could not remove {}: {}", tmp, e.toString());
            }
        }
    }

    private static boolean unchanged(Path file, byte[] bytes) {
        if (!Files.isRegularFile(file)) return false;
        try {
            return Files.size(file) == bytes.length && Arrays.equals(Files.readAllBytes(file), bytes);
        } catch (IOException e) {
            log.debug("Compare failed for {}: {}", file, e.toString());
            return false;
        }
    }
}
