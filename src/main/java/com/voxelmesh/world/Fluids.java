package com.voxelmesh.world;

import com.voxelmesh.world.mesh.meshable.TintMode;

/** Fluid registry. Ids index into {@link #byId(int)}. */
public final class Fluids {

    public static final Fluid NONE = new Fluid(0, "none", 0, 0, TintMode.NONE, false);
    public static final Fluid WATER = new Fluid(1, "water", 40, 41, TintMode.NEUTRAL, true);
    public static final Fluid LAVA = new Fluid(2, "lava", 42, 43, TintMode.NONE, true);

    private static final Fluid[] BY_ID = {NONE, WATER, LAVA};

    private Fluids() {}

    public static Fluid byId(int id) {
        if (id < 0 || id >= BY_ID.length) return NONE;
        return BY_ID[id];
    }

    public static int count() {
        return BY_ID.length;
    }
}
