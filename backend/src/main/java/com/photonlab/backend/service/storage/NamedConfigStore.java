package com.photonlab.backend.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.photonlab.backend.config.PhotonLabProperties;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.StoredFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Saved simulation configurations, one {@code <name>.json} per entry.
 */
@Component
public class NamedConfigStore extends FileStore {

    private static final Logger log = LoggerFactory.getLogger(NamedConfigStore.class);
    private static final String EXT = ".json";

    @Autowired
    public NamedConfigStore(PhotonLabProperties properties, ObjectMapper om) {
        this(Paths.get(properties.getStorage().getConfigsDir()), om, Clock.systemDefaultZone());
    }

    public NamedConfigStore(Path dir, ObjectMapper om, Clock clock) {
        super(dir, om, clock);
    }

    /**
     * @param name optional; defaults to {@code config_yyyyMMdd_HHmmss}
     * @return the stored name
     */
    public String save(SimulationConfig config, String name) {
        if (config == null) throw new IllegalArgumentException("Configuration is required");
        String stored = sanitize(name == null || name.isBlank() ? "config_" + timestamp() : name);
        lock.writeLock().lock();
        try {
            writeJson(resolve(stored, EXT), config);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("config saved: {}", stored);
        return stored;
    }

    public SimulationConfig load(String name) {
        lock.readLock().lock();
        try {
            return readJson(existing(name, EXT, "Config"), SimulationConfig.class);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<StoredFile> list() {
        return listFiles(EXT);
    }

    public String delete(String name) {
        lock.writeLock().lock();
        try {
            Path p = existing(name, EXT, "Config");
            Files.delete(p);
            return sanitize(name);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete config " + name, e);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
