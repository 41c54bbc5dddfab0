package com.cloud.emulator.dependency;

/**
 * Which edges of a relationship kind keep a resource from being deleted.
 */
public enum BlockingDirection {
    /** Edges leaving the resource: the resource still owns something. */
    OUTGOING,

    /** Edges arriving at the resource: something still uses it. */
    INCOMING
}
