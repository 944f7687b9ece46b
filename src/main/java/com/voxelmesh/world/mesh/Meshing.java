package com.voxelmesh.world.mesh;

import org.joml.Vector3fc;

/**
 * Destination for finished quads. The storage format is up to the implementation
 * (see {@link MeshingFactory}). Each quad carries four positions, a packed attribute
 * word and a packed texture repetition word (see {@link QuadData}).
 *
 * A meshing is owned by exactly one mesh data object and must be disposed by it.
 */
public interface Meshing {

    /** Push a quad. The vertices are in counter-clockwise order when viewed from the front. */
    void pushQuad(Vector3fc a, Vector3fc b, Vector3fc c, Vector3fc d, int data, int uv);

    /** Push a quad with every vertex moved by the given offset. */
    void pushQuadWithOffset(Vector3fc a, Vector3fc b, Vector3fc c, Vector3fc d, Vector3fc offset, int data, int uv);

    /** Number of quads pushed so far. */
    int count();

    /** Hint that the given number of additional quads will be pushed. */
    void grow(int quads);

    default boolean isEmpty() {
        return count() == 0;
    }

    /** Free the storage. Disposing twice is an error. */
    void dispose();

    boolean isDisposed();
}
