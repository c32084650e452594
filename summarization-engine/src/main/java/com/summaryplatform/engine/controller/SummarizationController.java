package com.summaryplatform.engine.controller;

import com.summaryplatform.common.exception.ConfigException;
import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.engine.model.SummarizerKind;
import com.summaryplatform.engine.model.SummaryConfig;
import com.summaryplatform.engine.model.SummaryRequest;
import com.summaryplatform.engine.service.SummarizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/summaries")
public class SummarizationController {

    private static final Logger log = LoggerFactory.getLogger(SummarizationController.class);

    private final SummarizationEngine engine;

    public SummarizationController(SummarizationEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public Mono<ResponseEntity<List<SummaryGroup>>> summaries(@RequestBody SummaryRequest request) {
        log.info("Summary request received. kinds={} config={}", request.kinds(), request.config());
        return Mono.defer(() -> engine.summaries(request.kinds(), requireConfig(request.config())))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Summary endpoint error. config={}", request.config(), e));
    }

    @PostMapping("/properties/{kind}")
    public Mono<ResponseEntity<Object>> properties(@PathVariable SummarizerKind kind,
                                                   @RequestBody SummaryConfig config) {
        log.info("Properties request received. kind={} config={}", kind, config);
        return Mono.defer(() -> engine.properties(kind, config))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Properties endpoint error. kind={} config={}", kind, config, e));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidate() {
        log.info("Cache invalidation requested");
        engine.invalidate();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static SummaryConfig requireConfig(SummaryConfig config) {
        if (config == null) {
            throw new ConfigException("SummarizationController", "config is required");
        }
        return config;
    }
}
