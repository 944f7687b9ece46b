package com.voxelmesh.world.mesh;

/**
 * The result of meshing one section: the basic opaque and transparent streams,
 * foliage and fluid. Filled during construction only and disposed exactly once,
 * by the renderer after upload or by whoever discards it.
 */
public final class SectionMeshData {

    private final Meshing basicOpaque;
    private final Meshing basicTransparent;
    private final Meshing foliage;
    private final Meshing fluid;

    private boolean disposed;

    public SectionMeshData(Meshing basicOpaque, Meshing basicTransparent, Meshing foliage, Meshing fluid) {
        this.basicOpaque = basicOpaque;
        this.basicTransparent = basicTransparent;
        this.foliage = foliage;
        this.fluid = fluid;
    }

    public Meshing getBasicOpaque() { return basicOpaque; }
    public Meshing getBasicTransparent() { return basicTransparent; }
    public Meshing getFoliage() { return foliage; }
    public Meshing getFluid() { return fluid; }

    /** Whether any stream holds geometry. Empty sections need no upload and no draw slot. */
    public boolean isFilled() {
        return !basicOpaque.isEmpty() || !basicTransparent.isEmpty() || !foliage.isEmpty() || !fluid.isEmpty();
    }

    /** Total number of quads over all streams. */
    public int getQuadCount() {
        return basicOpaque.count() + basicTransparent.count() + foliage.count() + fluid.count();
    }

    public boolean isDisposed() {
        return disposed;
    }

    public void dispose() {
        if (disposed) throw new IllegalStateException("Section mesh data disposed twice");
        disposed = true;

        basicOpaque.dispose();
        basicTransparent.dispose();
        foliage.dispose();
        fluid.dispose();
    }
}
