package com.kotsin.aggregation.controller;

import com.kotsin.aggregation.engine.DataEngine;
import com.kotsin.aggregation.model.AggregationResult;
import com.kotsin.aggregation.model.EngineStatus;
import com.kotsin.aggregation.source.CsvRecordSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * CSV upload and result endpoints. Uploaded files are streamed straight into the
 * engine; nothing is written to disk.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class SourceController {

    private final DataEngine engine;

    public SourceController(DataEngine engine) {
        this.engine = engine;
    }

    /**
     * Processes every uploaded file concurrently and reports a status per file.
     */
    @PostMapping("/process")
    public ResponseEntity<Map<String, Object>> process(
            @RequestParam(value = "files", required = false) List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            return ResponseEntity.badRequest().body(failure("No files uploaded", List.of()));
        }

        List<CompletableFuture<Map<String, Object>>> pending = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            pending.add(submit(file));
        }
        List<Map<String, Object>> results = new ArrayList<>(files.size());
        for (CompletableFuture<Map<String, Object>> future : pending) {
            results.add(future.join());
        }

        boolean hasErrors = results.stream().anyMatch(r -> "error".equals(r.get("status")));
        if (hasErrors) {
            return ResponseEntity.badRequest().body(failure("Error processing files", results));
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "Processed " + files.size() + " file(s)");
        response.put("filesProcessed", files.size());
        response.put("results", results);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/upload")
    public ResponseEntity<Map<String, Object>> upload(
            @RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(failure("No file uploaded", List.of()));
        }

        Map<String, Object> result = submit(file).join();
        if ("error".equals(result.get("status"))) {
            return ResponseEntity.badRequest().body(failure("Error processing file", List.of(result)));
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "File processed successfully");
        response.put("results", List.of(result));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/aggregations")
    public ResponseEntity<List<AggregationResult>> aggregations() {
        return ResponseEntity.ok(engine.getResults());
    }

    @GetMapping("/status")
    public ResponseEntity<EngineStatus> status() {
        return ResponseEntity.ok(engine.getStatus());
    }

    private CompletableFuture<Map<String, Object>> submit(MultipartFile file) {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
        CsvRecordSource source = new CsvRecordSource(filename,
                () -> new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8));

        return engine.processSource(source).handle((report, error) -> {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("filename", filename);
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.warn("Processing '{}' failed: {}", filename, cause.getMessage());
                result.put("status", "error");
                result.put("error", cause.getMessage());
            } else {
                result.put("status", "success");
                result.put("records", report.getRecordsProcessed());
                result.put("batches", report.getBatchesEmitted());
            }
            return result;
        });
    }

    private Map<String, Object> failure(String error, List<Map<String, Object>> results) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("error", error);
        response.put("results", results);
        return response;
    }
}
