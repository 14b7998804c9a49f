package com.photonlab.backend.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.photonlab.backend.domain.StoredFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Flat directory of JSON (and CSV) files addressed by user supplied names.
 * Names are reduced to {@code [A-Za-z0-9._-]} and every resolved path must stay inside {@link #dir}.
 */
abstract class FileStore {

    static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    protected final Path dir;
    protected final ObjectMapper om;
    protected final Clock clock;
    protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    protected FileStore(Path dir, ObjectMapper om, Clock clock) {
        this.dir = dir.toAbsolutePath().normalize();
        this.om = om;
        this.clock = clock;
    }

    public Path directory() {
        return dir;
    }

    /**
     * Replaces anything outside {@code [A-Za-z0-9._-]} with '_' and strips leading dots.
     *
     * @throws IllegalArgumentException when nothing usable is left
     */
    public static String sanitize(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Name is required");
        String cleaned = name.trim().replaceAll("[^A-Za-z0-9._-]", "_").replaceFirst("^\\.+", "");
        if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '_' || c == '.')) {
            throw new IllegalArgumentException("Invalid name: " + name);
        }
        return cleaned;
    }

    protected Path resolve(String name, String extension) {
        Path p = dir.resolve(sanitize(name) + extension).normalize();
        if (!p.startsWith(dir) || !dir.equals(p.getParent())) {
            throw new IllegalArgumentException("Path escapes the storage directory: " + name);
        }
        return p;
    }

    protected Path existing(String name, String extension, String what) {
        Path p = resolve(name, extension);
        if (!Files.isRegularFile(p)) throw new NoSuchElementException(what + " not found: " + sanitize(name));
        return p;
    }

    protected void ensureDir() {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + dir, e);
        }
    }

    protected void writeJson(Path target, Object value) {
        try {
            ensureDir();
            byte[] out = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
            Files.write(target, out, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target.getFileName(), e);
        }
    }

    protected <T> T readJson(Path source, Class<T> type) {
        try {
            return om.readValue(source.toFile(), type);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable file " + source.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Files with the given extension, newest first.
     */
    protected List<StoredFile> listFiles(String extension) {
        lock.readLock().lock();
        try {
            if (!Files.isDirectory(dir)) return List.of();
            List<StoredFile> out = new ArrayList<>();
            try (Stream<Path> files = Files.list(dir)) {
                for (Path p : (Iterable<Path>) files::iterator) {
                    String fileName = p.getFileName().toString();
                    if (!fileName.endsWith(extension) || !Files.isRegularFile(p)) continue;
                    BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                    out.add(new StoredFile(
                            fileName.substring(0, fileName.length() - extension.length()),
                            fileName,
                            attrs.lastModifiedTime().toInstant(),
                            attrs.size()));
                }
            }
            out.sort(Comparator.comparing(StoredFile::modified).reversed().thenComparing(StoredFile::name));
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    protected String timestamp() {
        return STAMP.format(clock.instant().atZone(clock.getZone()));
    }
}
