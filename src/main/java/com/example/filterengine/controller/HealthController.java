package com.example.filterengine.controller;

import com.example.filterengine.cache.CacheClient;
import com.example.filterengine.store.FilterStore;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final CacheClient cache;
    private final FilterStore store;
    private final String storeType;
    private final String cacheType;

    public HealthController(CacheClient cache, FilterStore store,
                            @Value("${app.store.type:mongo}") String storeType,
                            @Value("${app.cache.type:redis}") String cacheType) {
        this.cache = cache;
        this.store = store;
        this.storeType = storeType;
        this.cacheType = cacheType;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "model-filter-engine");
        health.put("version", "0.1.0");

        try {
            cache.get("health-check", new TypeReference<String>() {});
            health.put("cache", "UP");
        } catch (Exception e) {
            health.put("cache", "DOWN");
            health.put("cacheError", e.getMessage());
        }
        health.put("cacheType", cacheType);

        try {
            store.findFilter("health-check");
            health.put("store", "UP");
        } catch (Exception e) {
            health.put("store", "DOWN");
            health.put("storeError", e.getMessage());
        }
        health.put("storeType", storeType);

        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
