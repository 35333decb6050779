package com.tapmap.fountains.api.controller;

import com.tapmap.fountains.application.port.in.CheckHealthUseCase;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final CheckHealthUseCase checkHealthUseCase;

    public HealthController(CheckHealthUseCase checkHealthUseCase) {
        this.checkHealthUseCase = checkHealthUseCase;
    }

    /**
     * GET /health
     *
     * @return 200 when the fountain store answers, 503 otherwise
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = checkHealthUseCase.checkHealth();
        HttpStatus status = "healthy".equals(body.get("status")) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }
}
