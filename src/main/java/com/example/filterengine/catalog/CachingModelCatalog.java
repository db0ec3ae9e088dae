package com.example.filterengine.catalog;

import com.example.filterengine.cache.CacheClient;
import com.example.filterengine.model.ModelRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Serves the catalog from the cache and refills it from the delegate on a miss.
 * A failing cache degrades to direct reads.
 */
public class CachingModelCatalog implements ModelCatalog {

    private static final Logger logger = LoggerFactory.getLogger(CachingModelCatalog.class);
    static final String CACHE_KEY = "models";
    private static final TypeReference<List<ModelRecord>> MODEL_LIST = new TypeReference<>() {};

    private final ModelCatalog delegate;
    private final CacheClient cache;
    private final Duration ttl;

    public CachingModelCatalog(ModelCatalog delegate, CacheClient cache, Duration ttl) {
        this.delegate = delegate;
        this.cache = cache;
        this.ttl = ttl;
    }

    @Override
    public List<ModelRecord> fetchModels() {
        try {
            Optional<List<ModelRecord>> cached = cache.get(CACHE_KEY, MODEL_LIST);
            if (cached.isPresent()) {
                logger.debug("Model catalog served from cache ({} models)", cached.get().size());
                return cached.get();
            }
        } catch (RuntimeException e) {
            logger.warn("Cache read failed, falling back to catalog source: {}", e.getMessage());
        }

        List<ModelRecord> models = delegate.fetchModels();
        try {
            cache.set(CACHE_KEY, models, ttl);
        } catch (RuntimeException e) {
            logger.warn("Cache write failed for model catalog: {}", e.getMessage());
        }
        return models;
    }
}
