package com.voxelmesh.world.mesh;

import com.voxelmesh.world.BlockSide;
import org.joml.Vector3f;
import org.joml.Vector3ic;

/** Merges full, fixed height block faces. */
public final class SimpleFaceMerger extends MeshFaceMerger {

    public SimpleFaceMerger(BlockSide side) {
        super(side);
    }

    /**
     * Add a full face at the given section-local block position.
     *
     * @param data the attribute word, see {@link QuadData}
     */
    public void addFace(Vector3ic position, int data, boolean singleSided) {
        add(position.x(), position.y(), position.z(), MAX_HEIGHT, NO_HEIGHT, true, data, singleSided, true);
    }

    public void addFace(Vector3ic position, int data) {
        addFace(position, data, true);
    }

    @Override
    protected void applyHeight(Face face, Vector3f a, Vector3f b, Vector3f c, Vector3f d) {
        // Full faces keep their unit positions.
    }
}
