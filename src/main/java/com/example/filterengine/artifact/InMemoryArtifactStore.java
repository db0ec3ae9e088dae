package com.example.filterengine.artifact;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryArtifactStore implements ArtifactStore {

    static final String SCHEME = "memory://";

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public String store(String runId, String name, byte[] payload) {
        String reference = SCHEME + "runs/" + runId + "/" + name;
        blobs.put(reference, payload.clone());
        return reference;
    }

    @Override
    public void delete(String reference) {
        blobs.remove(reference);
    }

    public Optional<byte[]> load(String reference) {
        return Optional.ofNullable(blobs.get(reference)).map(byte[]::clone);
    }
}
