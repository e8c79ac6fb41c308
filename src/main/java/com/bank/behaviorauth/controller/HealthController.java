package com.bank.behaviorauth.controller;

import com.bank.behaviorauth.engine.scoring.ComponentHealthRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Availability of the decision pipeline components")
public class HealthController {

    private final ComponentHealthRegistry health;

    public HealthController(ComponentHealthRegistry health) {
        this.health = health;
    }

    @Operation(summary = "Get component health",
            description = "One flag per component (vector_store, similarity, drift, context_scorer, graph_scorer), " +
                    "reflecting its most recent call.")
    @GetMapping("/components")
    public ResponseEntity<Map<String, Boolean>> getComponents() {
        return ResponseEntity.ok(health.snapshot());
    }
}
