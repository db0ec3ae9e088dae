package com.example.filterengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Model reference kept on a run so the evaluated input set can be reproduced.
 */
@Value
@Builder
@AllArgsConstructor
public class CompactModel {
    String modelId;
    String name;
    String provider;

    public static CompactModel of(ModelRecord model) {
        Object provider = model.getAttributes().get("provider");
        return new CompactModel(model.getId(), model.getName(), provider != null ? provider.toString() : null);
    }
}
