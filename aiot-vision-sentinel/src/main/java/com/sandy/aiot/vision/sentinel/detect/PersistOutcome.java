package com.sandy.aiot.vision.sentinel.detect;

public enum PersistOutcome {
    CREATED,
    MERGED,
    /** An event with the same site, start and device set already exists. */
    DUPLICATE
}
