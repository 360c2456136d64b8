package com.brixo.colecture.image.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check del servicio.
 */
@RestController
public class HealthController {

    private final String serviceName;
    private final String version;

    public HealthController(@Value("${colecture.service.name:Colecture Image Service}") String serviceName,
            @Value("${colecture.service.version:1.0.0}") String version) {
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("service", serviceName, "status", "running", "version", version));
    }
}
