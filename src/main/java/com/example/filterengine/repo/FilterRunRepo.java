package com.example.filterengine.repo;

import com.example.filterengine.model.FilterRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Read side of the run history. Runs are written only through
 * {@code MongoTemplate.insert}, never through {@code save}.
 */
public interface FilterRunRepo extends MongoRepository<FilterRun, String> {
    Page<FilterRun> findByFilterId(String filterId, Pageable pageable);
    Optional<FilterRun> findByIdAndFilterId(String id, String filterId);
}
