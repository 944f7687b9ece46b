package com.voxelmesh.world.mesh.meshable;

/** How a block or fluid selects its tint. */
public enum TintMode {
    /** No tint. */
    NONE,
    /** The tint of the position, e.g. grass or water color of the biome. */
    NEUTRAL
}
