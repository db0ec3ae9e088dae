package com.example.filterengine.catalog;

import com.example.filterengine.model.ModelRecord;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads catalog documents (one attribute bag per model) ordered by model id.
 */
public class MongoModelCatalog implements ModelCatalog {

    private static final Logger logger = LoggerFactory.getLogger(MongoModelCatalog.class);

    private final MongoTemplate mongo;
    private final String collection;
    private final RetryPolicy retryPolicy;

    public MongoModelCatalog(MongoTemplate mongo, String collection, RetryPolicy retryPolicy) {
        this.mongo = mongo;
        this.collection = collection;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public List<ModelRecord> fetchModels() {
        List<ModelRecord> models = retryPolicy.execute("Model catalog fetch", () -> {
            Query query = new Query().with(Sort.by(Sort.Direction.ASC, "_id"));
            return mongo.find(query, Document.class, collection).stream()
                    .map(MongoModelCatalog::toRecord)
                    .collect(Collectors.toList());
        });
        logger.debug("Fetched {} models from collection {}", models.size(), collection);
        return models;
    }

    static ModelRecord toRecord(Document doc) {
        Map<String, Object> attributes = new LinkedHashMap<>(doc);
        Object mongoId = attributes.remove("_id");
        if (!attributes.containsKey("id") && mongoId != null) {
            attributes.put("id", mongoId.toString());
        }
        return ModelRecord.of(attributes);
    }
}
