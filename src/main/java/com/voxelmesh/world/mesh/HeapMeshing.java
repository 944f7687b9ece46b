package com.voxelmesh.world.mesh;

import org.joml.Vector3f;
import org.joml.Vector3fc;

import java.util.Arrays;

/**
 * {@link Meshing} backed by growable Java arrays. Used for tests, for CPU-side
 * processing and as a fallback when off-heap memory is not wanted.
 */
public class HeapMeshing extends AbstractMeshing {

    private float[] positions;
    private int[] attributes;

    public HeapMeshing(int sizeHint) {
        int quads = Math.max(sizeHint, 1);
        this.positions = new float[quads * FLOATS_PER_QUAD];
        this.attributes = new int[quads * INTS_PER_QUAD];
    }

    @Override
    protected void store(Vector3fc a, Vector3fc b, Vector3fc c, Vector3fc d, int data, int uv) {
        reserve(count() + 1);

        int p = count() * FLOATS_PER_QUAD;
        p = put(a, p);
        p = put(b, p);
        p = put(c, p);
        put(d, p);

        int i = count() * INTS_PER_QUAD;
        attributes[i] = data;
        attributes[i + 1] = uv;
    }

    private int put(Vector3fc v, int offset) {
        positions[offset] = v.x();
        positions[offset + 1] = v.y();
        positions[offset + 2] = v.z();
        return offset + 3;
    }

    @Override
    protected void reserve(int totalQuads) {
        if (totalQuads * FLOATS_PER_QUAD <= positions.length) return;

        int capacity = Math.max(positions.length / FLOATS_PER_QUAD * 2, totalQuads);
        positions = Arrays.copyOf(positions, capacity * FLOATS_PER_QUAD);
        attributes = Arrays.copyOf(attributes, capacity * INTS_PER_QUAD);
    }

    @Override
    protected void free() {
        positions = null;
        attributes = null;
    }

    /** Get a vertex (0 to 3) of a pushed quad. */
    public Vector3f getVertex(int quad, int vertex, Vector3f dest) {
        checkQuad(quad);
        int base = quad * FLOATS_PER_QUAD + vertex * 3;
        return dest.set(positions[base], positions[base + 1], positions[base + 2]);
    }

    public int getData(int quad) {
        checkQuad(quad);
        return attributes[quad * INTS_PER_QUAD];
    }

    public int getUV(int quad) {
        checkQuad(quad);
        return attributes[quad * INTS_PER_QUAD + 1];
    }

    /** Copy of all positions, twelve floats per quad. */
    public float[] getPositions() {
        checkNotDisposed();
        return Arrays.copyOf(positions, count() * FLOATS_PER_QUAD);
    }

    /** Copy of all attribute words, two ints per quad. */
    public int[] getAttributes() {
        checkNotDisposed();
        return Arrays.copyOf(attributes, count() * INTS_PER_QUAD);
    }

    private void checkQuad(int quad) {
        checkNotDisposed();
        if (quad < 0 || quad >= count()) {
            throw new IndexOutOfBoundsException("Quad " + quad + " of " + count());
        }
    }
}
