package com.voxelmesh.world;

/**
 * A fluid with its fill level at one position.
 * Levels go from 1 (a thin film) to {@link #MAX_LEVEL} (a full block).
 */
public record FluidInstance(Fluid fluid, int level, boolean isStatic) {

    public static final int MAX_LEVEL = 8;

    public static final FluidInstance NONE = new FluidInstance(Fluids.NONE, MAX_LEVEL, true);

    public boolean isEmpty() {
        return fluid == Fluids.NONE;
    }

    /** Height in the 0..15 scale used by varying height faces. */
    public int height() {
        return level * 2 - 1;
    }
}
