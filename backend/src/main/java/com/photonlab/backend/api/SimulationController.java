package com.photonlab.backend.api;

import com.photonlab.backend.api.dto.SimulationPreview;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SimulationResult;
import com.photonlab.backend.domain.ValidationResult;
import com.photonlab.backend.service.SimulationService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
public class SimulationController {

    private final SimulationService simulations;

    public SimulationController(SimulationService simulations) {
        this.simulations = simulations;
    }

    // findings only; an invalid config is still a 200 here
    @PostMapping("/validate")
    public ValidationResult validate(@RequestBody SimulationConfig body) {
        return simulations.validate(body);
    }

    @PostMapping("/simulate")
    public SimulationResult simulate(@RequestBody SimulationConfig body) {
        return simulations.simulate(body);
    }

    @PostMapping("/simulate/preview")
    public SimulationPreview preview(@RequestBody SimulationConfig body) {
        return simulations.previewSimulation(body);
    }
}
