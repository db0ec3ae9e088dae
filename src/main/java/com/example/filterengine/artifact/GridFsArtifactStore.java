package com.example.filterengine.artifact;

import com.example.filterengine.error.PersistenceException;
import com.mongodb.MongoException;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.time.Instant;

@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
public class GridFsArtifactStore implements ArtifactStore {

    private static final Logger logger = LoggerFactory.getLogger(GridFsArtifactStore.class);
    static final String SCHEME = "gridfs://";

    private final GridFsTemplate gridFs;

    public GridFsArtifactStore(GridFsTemplate gridFs) {
        this.gridFs = gridFs;
    }

    @Override
    public String store(String runId, String name, byte[] payload) {
        Document metadata = new Document("runId", runId).append("storedAt", Instant.now().toString());
        try {
            ObjectId id = gridFs.store(new ByteArrayInputStream(payload), "runs/" + runId + "/" + name,
                    "application/json", metadata);
            logger.debug("Stored artifact {} for run {} ({} bytes)", name, runId, payload.length);
            return SCHEME + id.toHexString();
        } catch (DataAccessException | MongoException e) {
            throw new PersistenceException("Failed to store artifact " + name + " for run " + runId, e);
        }
    }

    @Override
    public void delete(String reference) {
        if (reference == null || !reference.startsWith(SCHEME)) {
            return;
        }
        String hex = reference.substring(SCHEME.length());
        if (!ObjectId.isValid(hex)) {
            return;
        }
        try {
            gridFs.delete(Query.query(Criteria.where("_id").is(new ObjectId(hex))));
            logger.debug("Deleted artifact {}", reference);
        } catch (DataAccessException | MongoException e) {
            throw new PersistenceException("Failed to delete artifact " + reference, e);
        }
    }
}
