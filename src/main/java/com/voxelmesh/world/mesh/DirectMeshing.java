package com.voxelmesh.world.mesh;

import org.joml.Vector3fc;
import org.lwjgl.system.MemoryUtil;

import java.nio.FloatBuffer;
import java.nio.IntBuffer;

/**
 * {@link Meshing} backed by off-heap buffers from {@link MemoryUtil}, ready for
 * upload with {@code glBufferData}. The buffers must be freed through {@link #dispose()}.
 */
public class DirectMeshing extends AbstractMeshing {

    private FloatBuffer positions;
    private IntBuffer attributes;

    public DirectMeshing(int sizeHint) {
        int quads = Math.max(sizeHint, 1);
        this.positions = MemoryUtil.memAllocFloat(quads * FLOATS_PER_QUAD);
        this.attributes = MemoryUtil.memAllocInt(quads * INTS_PER_QUAD);
    }

    @Override
    protected void store(Vector3fc a, Vector3fc b, Vector3fc c, Vector3fc d, int data, int uv) {
        reserve(count() + 1);
        a.get(positions);
        positions.position(positions.position() + 3);
        b.get(positions);
        positions.position(positions.position() + 3);
        c.get(positions);
        positions.position(positions.position() + 3);
        d.get(positions);
        positions.position(positions.position() + 3);
        attributes.put(data).put(uv);
    }

    @Override
    protected void reserve(int totalQuads) {
        if (totalQuads * FLOATS_PER_QUAD > positions.capacity()) {
            int capacity = Math.max(positions.capacity() / FLOATS_PER_QUAD * 2, totalQuads);
            positions = MemoryUtil.memRealloc(positions, capacity * FLOATS_PER_QUAD);
            attributes = MemoryUtil.memRealloc(attributes, capacity * INTS_PER_QUAD);
        }
    }

    @Override
    protected void free() {
        MemoryUtil.memFree(positions);
        MemoryUtil.memFree(attributes);
        positions = null;
        attributes = null;
    }

    /** Flipped view of the written positions. The view is invalid after dispose or further pushes. */
    public FloatBuffer getPositions() {
        checkNotDisposed();
        return positions.duplicate().flip();
    }

    /** Flipped view of the written attribute words. The view is invalid after dispose or further pushes. */
    public IntBuffer getAttributes() {
        checkNotDisposed();
        return attributes.duplicate().flip();
    }
}
