package com.example.filterengine.repo;

import com.example.filterengine.model.SavedFilter;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SavedFilterRepo extends MongoRepository<SavedFilter, String> {}
