package com.example.readcache.core;

/**
 * Thrown by a cache backend that is configured but not wired to anything yet.
 * Distinguishes "backend missing" from an ordinary cache miss.
 */
public class BackendNotImplementedException extends RuntimeException {

    private final String backend;
    private final String operation;

    public BackendNotImplementedException(String backend, String operation) {
        super(backend + ": " + operation + " is not implemented");
        this.backend = backend;
        this.operation = operation;
    }

    public String getBackend() {
        return backend;
    }

    public String getOperation() {
        return operation;
    }
}
