package com.example.filterengine.artifact;

/**
 * External blob storage for run payloads too large to keep inline.
 */
public interface ArtifactStore {

    /**
     * Stores {@code payload} and returns a reference to put in a run's {@code artifacts}.
     *
     * @throws com.example.filterengine.error.PersistenceException if the write fails
     */
    String store(String runId, String name, byte[] payload);

    /**
     * Removes a previously stored payload. Unknown references are ignored.
     */
    void delete(String reference);
}
