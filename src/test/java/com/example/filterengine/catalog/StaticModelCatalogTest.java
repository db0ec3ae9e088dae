package com.example.filterengine.catalog;

import com.example.filterengine.model.ModelRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StaticModelCatalogTest {

    @Test
    void testLoad_BundledCatalog() {
        StaticModelCatalog catalog = StaticModelCatalog.load(new ClassPathResource("catalog/models.json"), new ObjectMapper());

        List<ModelRecord> models = catalog.fetchModels();

        assertFalse(models.isEmpty());
        ModelRecord gpt4 = models.get(0);
        assertEquals("gpt-4", gpt4.getId());
        assertEquals(List.of("text"), gpt4.lookup("modalities.input").orElseThrow());
    }

    @Test
    void testLoad_MissingResource() {
        assertThrows(IllegalStateException.class,
                () -> StaticModelCatalog.load(new ClassPathResource("catalog/absent.json"), new ObjectMapper()));
    }
}
