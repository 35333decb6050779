package com.tapmap.fountains.application.service;

import com.tapmap.fountains.application.port.in.CheckHealthUseCase;
import com.tapmap.fountains.application.port.out.FountainStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class HealthCheckService implements CheckHealthUseCase {

    private static final Logger logger = LoggerFactory.getLogger(HealthCheckService.class);

    private final FountainStore fountainStore;

    public HealthCheckService(FountainStore fountainStore) {
        this.fountainStore = fountainStore;
    }

    @Override
    public Map<String, Object> checkHealth() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            long active = fountainStore.countActive();
            body.put("status", "healthy");
            body.put("database", "connected");
            body.put("activeFountains", active);
        } catch (FountainStore.StoreUnavailableException e) {
            logger.warn("Health check could not reach the fountain store: {}", e.getMessage());
            body.put("status", "unhealthy");
            body.put("database", "unavailable");
            body.put("error", e.getMessage());
        }
        return body;
    }
}
