package com.photonlab.backend.api;

import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.layer.LayerStackConfig;
import com.photonlab.backend.domain.layer.ResolvedLayer;
import com.photonlab.backend.service.LayerStackTranslator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/layer-stack")
public class LayerStackController {

    private final LayerStackTranslator translator;

    public LayerStackController(LayerStackTranslator translator) {
        this.translator = translator;
    }

    /**
     * {@code base_config} supplies excitation, wavelength range and basis size; defaults when absent.
     */
    public record CanonicalReq(
            LayerStackConfig layerStack,
            SimulationConfig baseConfig
    ) {}

    @PostMapping("/canonical")
    public SimulationConfig toCanonical(@RequestBody CanonicalReq body) {
        if (body == null || body.layerStack() == null) throw bad("layer_stack is required");
        SimulationConfig base = body.baseConfig() == null ? SimulationConfig.defaults() : body.baseConfig();
        return translator.toCanonical(body.layerStack(), base);
    }

    @PostMapping("/from-canonical")
    public LayerStackConfig fromCanonical(@RequestBody SimulationConfig body) {
        if (body == null) throw bad("config is required");
        return translator.fromCanonical(body);
    }

    @PostMapping("/resolve")
    public Map<String, Object> resolve(@RequestBody LayerStackConfig body) {
        if (body == null) throw bad("layer stack is required");
        List<ResolvedLayer> layers = translator.resolve(body);
        return Map.of("layers", layers);
    }

    private static ResponseStatusException bad(String msg) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, msg);
    }
}
