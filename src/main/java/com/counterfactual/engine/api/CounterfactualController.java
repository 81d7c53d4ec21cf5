package com.counterfactual.engine.api;

import com.counterfactual.engine.api.dto.CompareRequest;
import com.counterfactual.engine.api.dto.GenerateRequest;
import com.counterfactual.engine.domain.exception.SchemaException;
import com.counterfactual.engine.domain.service.CounterfactualRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@RestController
@RequestMapping("/api/counterfactual")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CounterfactualController {

    private final CounterfactualRunService runService;

    @PostMapping("/generate")
    public ResponseEntity<Object> generate(@RequestBody GenerateRequest request) {
        log.info("[CF API] generate request received");
        return handle(() -> runService.generate(request));
    }

    @GetMapping("/latest")
    public ResponseEntity<Object> latest() {
        return runService.getLatest()
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "success", false,
                        "message", "No counterfactual run yet. POST /api/counterfactual/generate first.")));
    }

    @GetMapping("/runs")
    public ResponseEntity<Object> runs() {
        return ResponseEntity.ok(runService.recentRuns());
    }

    @PostMapping("/compare")
    public ResponseEntity<Object> compare(@RequestBody CompareRequest request) {
        log.info("[CF API] compare request received");
        return handle(() -> runService.compare(request));
    }

    private ResponseEntity<Object> handle(Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (SchemaException e) {
            log.warn("[CF API] schema rejected: reason={}, message={}", e.getReason(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                    "success", false,
                    "error", e.getReason().name(),
                    "message", e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.warn("[CF API] invalid request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", "INVALID_REQUEST",
                    "message", String.valueOf(e.getMessage())));
        }
    }
}
