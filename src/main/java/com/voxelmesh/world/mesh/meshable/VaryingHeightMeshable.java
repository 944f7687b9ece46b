package com.voxelmesh.world.mesh.meshable;

import com.voxelmesh.world.Block;
import com.voxelmesh.world.BlockInstance;
import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.mesh.MeshFaceMerger;
import com.voxelmesh.world.mesh.QuadData;
import com.voxelmesh.world.mesh.SectionMeshBuilder;
import org.joml.Vector3ic;

/**
 * Block with a height of 0 to 15 taken from its data, such as a snow layer.
 * At full height it meshes like a simple block. Otherwise the lateral and top
 * faces go to the varying height merger; the bottom is always a simple face.
 */
public class VaryingHeightMeshable implements BlockMeshable {

    private final int texture;
    private final TintMode tint;

    public VaryingHeightMeshable(int texture, TintMode tint) {
        this.texture = texture;
        this.tint = tint;
    }

    public static int getHeight(int data) {
        return data;
    }

    @Override
    public boolean isValid(int data) {
        return data >= 0 && data <= MeshFaceMerger.MAX_HEIGHT;
    }

    @Override
    public boolean isSideFull(Block block, BlockSide side, int data) {
        return side == BlockSide.BOTTOM || getHeight(data) == MeshFaceMerger.MAX_HEIGHT;
    }

    @Override
    public void createMesh(Vector3ic position, BlockMeshInfo info, SectionMeshBuilder builder) {
        int height = getHeight(info.data());
        boolean fullHeight = height == MeshFaceMerger.MAX_HEIGHT;

        for (BlockSide side : BlockSide.sides()) {
            BlockInstance neighbor = builder.getBlock(position, side);

            // A partial top face is never hidden.
            if ((side != BlockSide.TOP || fullHeight) && SimpleMeshable.isHiddenFace(info.block(), neighbor, side)) {
                continue;
            }

            if (side == BlockSide.BOTTOM || fullHeight) {
                SimpleMeshable.addSimpleFace(position, side, texture, tint, false, info.block().opaque(), builder);
            } else {
                addPartialFace(position, side, height, neighbor, info, builder);
            }
        }
    }

    private void addPartialFace(Vector3ic position, BlockSide side, int height, BlockInstance neighbor,
                                BlockMeshInfo info, SectionMeshBuilder builder) {
        // Equal neighbors hide each other's lateral faces.
        if (side != BlockSide.TOP && neighbor != null
            && neighbor.block().meshable() instanceof VaryingHeightMeshable
            && getHeight(neighbor.data()) == height) {
            return;
        }

        int data = QuadData.texture(texture);
        if (tint == TintMode.NEUTRAL) data = QuadData.withTint(data, builder.getBlockTint(position));

        builder.getVaryingHeightMerger(side, info.block().opaque()).addFace(
            position, height, MeshFaceMerger.NO_HEIGHT, true, data, true, false);
    }
}
