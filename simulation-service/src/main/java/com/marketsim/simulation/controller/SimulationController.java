package com.marketsim.simulation.controller;

import com.marketsim.simulation.dto.RunSummary;
import com.marketsim.simulation.dto.SeriesPoint;
import com.marketsim.simulation.dto.SimulationRunRequest;
import com.marketsim.simulation.service.SimulationRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST API for running simulations and reading back the latest result.
 *
 * <ol>
 *   <li>POST /run: runs one simulation; the body may override agent count,
 *       seed, step schedule, starting state and starting value</li>
 *   <li>GET  /latest: summary of the most recent run</li>
 *   <li>GET  /latest/series: aggregate active value per year, for charting</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/simulation")
public class SimulationController {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private final SimulationRunService runService;

    public SimulationController(SimulationRunService runService) {
        this.runService = runService;
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<Object>> run(@RequestBody(required = false) SimulationRunRequest request) {
        log.info("[SimulationAPI] run requested. request={}", request);
        return runService.runAsync(request)
            .map(summary -> ResponseEntity.ok().<Object>body(summary))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("[SimulationAPI] rejected run request. reason={}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().<Object>body(Map.of("error", e.getMessage())));
            })
            .onErrorResume(e -> {
                log.error("[SimulationAPI] run failed", e);
                return Mono.just(ResponseEntity.<Object>status(500)
                    .body(Map.of("error", String.valueOf(e.getMessage()))));
            });
    }

    @GetMapping("/latest")
    public ResponseEntity<RunSummary> latest() {
        return runService.latest()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/latest/series")
    public ResponseEntity<List<SeriesPoint>> latestSeries() {
        return runService.latest()
            .map(summary -> ResponseEntity.ok(summary.series()))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
