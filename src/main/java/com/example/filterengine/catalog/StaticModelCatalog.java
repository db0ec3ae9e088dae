package com.example.filterengine.catalog;

import com.example.filterengine.model.ModelRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fixed catalog loaded once from a JSON array, for local runs without a model database.
 */
public class StaticModelCatalog implements ModelCatalog {

    private final List<ModelRecord> models;

    public StaticModelCatalog(List<ModelRecord> models) {
        this.models = List.copyOf(models);
    }

    public static StaticModelCatalog load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            List<Map<String, Object>> raw = objectMapper.readValue(in, new TypeReference<List<Map<String, Object>>>() {});
            return new StaticModelCatalog(raw.stream().map(ModelRecord::of).collect(Collectors.toList()));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load model catalog from " + resource, e);
        }
    }

    @Override
    public List<ModelRecord> fetchModels() {
        return models;
    }
}
