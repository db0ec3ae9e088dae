package com.example.filterengine.config;

import com.example.filterengine.cache.CacheClient;
import com.example.filterengine.catalog.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

@Configuration
public class CatalogConfig {

    private static final Logger logger = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public ModelCatalog modelCatalog(@Value("${app.catalog.type:mongo}") String type,
                                     @Value("${app.catalog.collection:models}") String collection,
                                     @Value("${app.catalog.static-resource:classpath:catalog/models.json}") String staticResource,
                                     @Value("${app.catalog.cache-ttl:PT1H}") Duration cacheTtl,
                                     @Value("${app.catalog.retry.max-attempts:3}") int maxAttempts,
                                     @Value("${app.catalog.retry.initial-delay:PT1S}") Duration initialDelay,
                                     ObjectProvider<MongoTemplate> mongo,
                                     ObjectMapper objectMapper,
                                     ResourceLoader resourceLoader,
                                     CacheClient cache) {
        ModelCatalog source;
        if ("static".equalsIgnoreCase(type)) {
            source = StaticModelCatalog.load(resourceLoader.getResource(staticResource), objectMapper);
            logger.info("Using static model catalog from {}", staticResource);
        } else {
            source = new MongoModelCatalog(mongo.getObject(), collection, new RetryPolicy(maxAttempts, initialDelay));
            logger.info("Using MongoDB model catalog (collection={}, maxAttempts={})", collection, maxAttempts);
        }
        return new CachingModelCatalog(source, cache, cacheTtl);
    }
}
