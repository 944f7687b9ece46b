package com.voxelmesh.world;

/** Access mode for a chunk's core data. */
public enum Access {
    /** Shared; any number of readers may hold it at once. */
    READ,
    /** Exclusive; no reader or other writer may hold access at the same time. */
    WRITE
}
