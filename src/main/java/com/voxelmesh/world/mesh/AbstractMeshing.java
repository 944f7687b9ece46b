package com.voxelmesh.world.mesh;

import org.joml.Vector3f;
import org.joml.Vector3fc;

/**
 * Common bookkeeping for {@link Meshing} implementations: quad counting,
 * offset handling and the dispose-once contract.
 */
public abstract class AbstractMeshing implements Meshing {

    /** Floats per quad: four vertices with three coordinates each. */
    public static final int FLOATS_PER_QUAD = 12;
    /** Ints per quad: the attribute word and the repetition word. */
    public static final int INTS_PER_QUAD = 2;

    private final Vector3f oa = new Vector3f();
    private final Vector3f ob = new Vector3f();
    private final Vector3f oc = new Vector3f();
    private final Vector3f od = new Vector3f();

    private int count;
    private boolean disposed;

    @Override
    public final void pushQuad(Vector3fc a, Vector3fc b, Vector3fc c, Vector3fc d, int data, int uv) {
        checkNotDisposed();
        store(a, b, c, d, data, uv);
        count++;
    }

    @Override
    public final void pushQuadWithOffset(Vector3fc a, Vector3fc b, Vector3fc c, Vector3fc d,
                                         Vector3fc offset, int data, int uv) {
        pushQuad(a.add(offset, oa), b.add(offset, ob), c.add(offset, oc), d.add(offset, od), data, uv);
    }

    @Override
    public final int count() {
        return count;
    }

    @Override
    public final void grow(int quads) {
        checkNotDisposed();
        if (quads > 0) reserve(count + quads);
    }

    @Override
    public final void dispose() {
        if (disposed) throw new IllegalStateException(getClass().getSimpleName() + " disposed twice");
        disposed = true;
        free();
    }

    @Override
    public final boolean isDisposed() {
        return disposed;
    }

    protected void checkNotDisposed() {
        if (disposed) throw new IllegalStateException(getClass().getSimpleName() + " used after dispose");
    }

    /** Store one quad at index {@link #count()}. */
    protected abstract void store(Vector3fc a, Vector3fc b, Vector3fc c, Vector3fc d, int data, int uv);

    /** Make room for at least the given total number of quads. */
    protected abstract void reserve(int totalQuads);

    protected abstract void free();
}
