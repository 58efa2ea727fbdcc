package com.phillippitts.audiometer.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe for the browser front end and load balancers.
 * Detailed component health lives at /actuator/health.
 */
@RestController
class HealthController {

    private static final Logger log = LogManager.getLogger(HealthController.class);

    @GetMapping("/health")
    ResponseEntity<Map<String, String>> health() {
        log.info("Health check received");
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
