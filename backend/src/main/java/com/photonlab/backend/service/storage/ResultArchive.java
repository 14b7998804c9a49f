package com.photonlab.backend.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.photonlab.backend.config.PhotonLabProperties;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SimulationResult;
import com.photonlab.backend.domain.StoredFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Saved spectra. JSON keeps the whole result; CSV writes one two-column file per quantity.
 */
@Component
public class ResultArchive extends FileStore {

    private static final Logger log = LoggerFactory.getLogger(ResultArchive.class);

    public enum Format {
        JSON(".json"), CSV(".csv");

        private final String extension;

        Format(String extension) {
            this.extension = extension;
        }

        public String extension() {
            return extension;
        }

        public static Format fromWire(String raw) {
            if (raw == null || raw.isBlank()) return JSON;
            for (Format f : values()) {
                if (f.name().equalsIgnoreCase(raw.trim())) return f;
            }
            throw new IllegalArgumentException("Invalid format. Use 'json' or 'csv'");
        }
    }

    @Autowired
    public ResultArchive(PhotonLabProperties properties, ObjectMapper om) {
        this(Paths.get(properties.getStorage().getResultsDir()), om, Clock.systemDefaultZone());
    }

    public ResultArchive(Path dir, ObjectMapper om, Clock clock) {
        super(dir, om, clock);
    }

    /**
     * e.g. {@code 3.6800n_0.500a_0.150r_0.160t_3.0h}
     */
    public static String baseName(SimulationConfig c) {
        return String.format(Locale.ROOT, "%.4fn_%.3fa_%.3fr_%.3ft_%.1fh",
                c.nSilicon(), c.latticeConstant(), c.radius(), c.thickness(), c.glassThickness());
    }

    /**
     * @return stored name (without extension)
     */
    public String saveJson(SimulationResult result) {
        requireConfig(result);
        String name = baseName(result.config()) + "_" + timestamp();
        lock.writeLock().lock();
        try {
            writeJson(resolve(name, Format.JSON.extension()), result);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("result saved: {}.json", name);
        return name;
    }

    /**
     * Writes {@code _T/_R/_A} and {@code _phaseT/_phaseR} files for the series that are present.
     *
     * @return series key to stored file name
     */
    public Map<String, String> saveCsv(SimulationResult result) {
        requireConfig(result);
        String base = baseName(result.config());
        Map<String, String> saved = new LinkedHashMap<>();
        lock.writeLock().lock();
        try {
            ensureDir();
            if (!isEmpty(result.transmittance())) {
                writeSeries(saved, base, "T", "T", result.wavelengths(), result.transmittance());
                writeSeries(saved, base, "R", "R", result.wavelengths(), result.reflectance());
                writeSeries(saved, base, "A", "A", result.wavelengths(), result.absorptance());
            }
            if (!isEmpty(result.transmissionPhase())) {
                writeSeries(saved, base, "phaseT", "phase_pi", result.wavelengths(), result.transmissionPhase());
                writeSeries(saved, base, "phaseR", "phase_pi", result.wavelengths(), result.reflectionPhase());
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("result saved as {} csv file(s) under {}", saved.size(), base);
        return saved;
    }

    public SimulationResult load(String name) {
        lock.readLock().lock();
        try {
            return readJson(existing(name, Format.JSON.extension(), "Results"), SimulationResult.class);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<StoredFile> list() {
        return listFiles(Format.JSON.extension());
    }

    /**
     * Path of a stored file for download.
     */
    public Path file(String name, Format format) {
        lock.readLock().lock();
        try {
            return existing(name, format.extension(), "File");
        } finally {
            lock.readLock().unlock();
        }
    }

    private void writeSeries(Map<String, String> saved, String base, String key, String header,
                             List<Double> wavelengths, List<Double> values) {
        if (isEmpty(values)) return;
        String name = base + "_" + key;
        Path target = resolve(name, Format.CSV.extension());
        try (BufferedWriter w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            w.write("wavelength_nm," + header);
            w.newLine();
            int rows = Math.min(wavelengths.size(), values.size());
            for (int i = 0; i < rows; i++) {
                w.write(wavelengths.get(i) + "," + values.get(i));
                w.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target.getFileName(), e);
        }
        saved.put(key, target.getFileName().toString());
    }

    private static void requireConfig(SimulationResult result) {
        if (result == null || result.config() == null) {
            throw new IllegalArgumentException("Result with its configuration is required");
        }
        if (result.wavelengths() == null) throw new IllegalArgumentException("wavelengths are required");
    }

    private static boolean isEmpty(List<Double> values) {
        return values == null || values.isEmpty();
    }
}
