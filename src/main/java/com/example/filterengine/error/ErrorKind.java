package com.example.filterengine.error;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    ACCESS_DENIED,
    CATALOG_UNAVAILABLE,
    PERSISTENCE
}
