package com.photonlab.backend.api;

import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.service.storage.NamedConfigStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/configs")
public class ConfigController {

    private final NamedConfigStore store;

    public ConfigController(NamedConfigStore store) {
        this.store = store;
    }

    @GetMapping
    public Map<String, Object> list() {
        return Map.of("configs", store.list());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> save(@RequestParam(required = false) String name,
                                                    @RequestBody SimulationConfig body) {
        String stored = store.save(body, name);
        return ResponseEntity.status(201).body(Map.of("message", "Config saved", "name", stored));
    }

    @GetMapping("/{name}")
    public SimulationConfig load(@PathVariable String name) {
        return store.load(name);
    }

    @DeleteMapping("/{name}")
    public Map<String, Object> delete(@PathVariable String name) {
        return Map.of("message", "Config deleted", "name", store.delete(name));
    }
}
