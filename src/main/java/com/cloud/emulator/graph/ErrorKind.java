package com.cloud.emulator.graph;

/**
 * Kinds of failures reported by the relationship graph and the resource manager.
 * Service handlers map these to provider error codes.
 */
public enum ErrorKind {
    NOT_FOUND,
    ALREADY_EXISTS,
    WOULD_CREATE_CYCLE,
    SCHEMA_VIOLATION,
    DEPENDENCY_VIOLATION
}
