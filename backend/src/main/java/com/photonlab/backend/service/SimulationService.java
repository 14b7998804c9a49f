package com.photonlab.backend.service;

import com.photonlab.backend.api.dto.SimulationPreview;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SimulationResult;
import com.photonlab.backend.domain.ValidationResult;
import com.photonlab.backend.service.solver.SpectrumSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single synchronous simulation outside of any sweep.
 */
@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final ConfigValidator validator;
    private final SweepPlanner planner;
    private final SpectrumSolver solver;

    public SimulationService(ConfigValidator validator, SweepPlanner planner, SpectrumSolver solver) {
        this.validator = validator;
        this.planner = planner;
        this.solver = solver;
    }

    public ValidationResult validate(SimulationConfig config) {
        return validator.validate(config);
    }

    /**
     * @throws ConfigValidationException on invalid input; the solver is not called
     */
    public SimulationResult simulate(SimulationConfig config) {
        ValidationResult validation = validator.validate(config);
        if (!validation.valid()) throw new ConfigValidationException(validation);

        long t0 = System.nanoTime();
        SimulationResult result = solver.simulate(config);
        log.info("simulation finished in {}ms ({} wavelengths)",
                (System.nanoTime() - t0) / 1_000_000, config.wavelength().pointCount());
        return result;
    }

    public SimulationPreview previewSimulation(SimulationConfig config) {
        if (config == null || config.wavelength() == null) {
            throw new IllegalArgumentException("wavelength range is required");
        }
        int cpus = Runtime.getRuntime().availableProcessors();
        return new SimulationPreview(
                config.wavelength().pointCount(),
                config.wavelength(),
                planner.estimateSingleRun(config, 1),
                cpus
        );
    }
}
