package com.example.filterengine.catalog;

import com.example.filterengine.model.ModelRecord;

import java.util.List;

/**
 * Source of candidate models. Implementations own their own timeout and retry behaviour.
 *
 * @throws com.example.filterengine.error.CatalogUnavailableException when models cannot be fetched
 */
public interface ModelCatalog {
    List<ModelRecord> fetchModels();
}
