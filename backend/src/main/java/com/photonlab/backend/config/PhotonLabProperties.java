package com.photonlab.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "photonlab")
public class PhotonLabProperties {

    @Valid
    private final Sweep sweep = new Sweep();
    @Valid
    private final Jobs jobs = new Jobs();
    @Valid
    private final Solver solver = new Solver();
    @Valid
    private final Storage storage = new Storage();
    @Valid
    private final Cors cors = new Cors();

    public Sweep getSweep() { return sweep; }
    public Jobs getJobs() { return jobs; }
    public Solver getSolver() { return solver; }
    public Storage getStorage() { return storage; }
    public Cors getCors() { return cors; }

    public static class Sweep {
        /** Worker loops per job; 0 means one per available processor. */
        @Min(0)
        private int maxWorkersPerJob = 0;
        /** Solver calls in flight across all jobs; 0 means one per available processor. */
        @Min(0)
        private int maxConcurrentSolves = 0;
        /** Per-simulation timeout; zero disables it. */
        @NotNull
        private Duration taskTimeout = Duration.ZERO;
        @DecimalMin("0.0")
        private double secondsPerWavelength = 0.01;
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double parallelEfficiency = 0.7;
        @Min(1)
        private int latencyWindow = 16;
        /** Upper bound on the simulations one sweep request may expand to. */
        @Min(1)
        private int maxSimulations = 100_000;

        public int getMaxWorkersPerJob() { return maxWorkersPerJob; }
        public void setMaxWorkersPerJob(int maxWorkersPerJob) { this.maxWorkersPerJob = maxWorkersPerJob; }

        public int getMaxConcurrentSolves() { return maxConcurrentSolves; }
        public void setMaxConcurrentSolves(int maxConcurrentSolves) { this.maxConcurrentSolves = maxConcurrentSolves; }

        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }

        public double getSecondsPerWavelength() { return secondsPerWavelength; }
        public void setSecondsPerWavelength(double secondsPerWavelength) { this.secondsPerWavelength = secondsPerWavelength; }

        public double getParallelEfficiency() { return parallelEfficiency; }
        public void setParallelEfficiency(double parallelEfficiency) { this.parallelEfficiency = parallelEfficiency; }

        public int getLatencyWindow() { return latencyWindow; }
        public void setLatencyWindow(int latencyWindow) { this.latencyWindow = latencyWindow; }

        public int getMaxSimulations() { return maxSimulations; }
        public void setMaxSimulations(int maxSimulations) { this.maxSimulations = maxSimulations; }

        public int resolvedWorkersPerJob() {
            return maxWorkersPerJob > 0 ? maxWorkersPerJob : Runtime.getRuntime().availableProcessors();
        }

        public int resolvedConcurrentSolves() {
            return maxConcurrentSolves > 0 ? maxConcurrentSolves : Runtime.getRuntime().availableProcessors();
        }
    }

    public static class Jobs {
        /** Age after which finished jobs are evicted by cleanup. */
        @NotNull
        private Duration retention = Duration.ofDays(30);

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    public static class Solver {
        @NotBlank
        private String baseUrl = "http://localhost:8000";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofMinutes(30);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public static class Storage {
        @NotBlank
        private String configsDir = "configs";
        @NotBlank
        private String resultsDir = "DATA";

        public String getConfigsDir() { return configsDir; }
        public void setConfigsDir(String configsDir) { this.configsDir = configsDir; }

        public String getResultsDir() { return resultsDir; }
        public void setResultsDir(String resultsDir) { this.resultsDir = resultsDir; }
    }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of(
                "http://localhost:5173", "http://localhost:3000", "http://127.0.0.1:5173"));

        public List<String> getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }
}
