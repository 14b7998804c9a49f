package com.photonlab.backend.api;

import com.photonlab.backend.domain.SimulationResult;
import com.photonlab.backend.service.storage.ResultArchive;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/results")
public class ResultController {

    private final ResultArchive archive;

    public ResultController(ResultArchive archive) {
        this.archive = archive;
    }

    @GetMapping
    public Map<String, Object> list() {
        return Map.of("results", archive.list());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> save(@RequestParam(defaultValue = "json") String format,
                                                    @RequestBody SimulationResult body) {
        ResultArchive.Format f = ResultArchive.Format.fromWire(format);
        Map<String, Object> out = f == ResultArchive.Format.CSV
                ? Map.of("message", "Results saved", "files", archive.saveCsv(body))
                : Map.of("message", "Results saved", "name", archive.saveJson(body));
        return ResponseEntity.status(201).body(out);
    }

    @GetMapping("/{name}")
    public SimulationResult load(@PathVariable String name) {
        return archive.load(name);
    }

    @GetMapping("/{name}/download")
    public ResponseEntity<Resource> download(@PathVariable String name,
                                             @RequestParam(defaultValue = "json") String format) {
        Path file = archive.file(name, ResultArchive.Format.fromWire(format));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file.getFileName().toString()).build().toString())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(new FileSystemResource(file));
    }
}
