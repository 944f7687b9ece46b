package com.voxelmesh.world.mesh.meshable;

import com.voxelmesh.world.Block;
import com.voxelmesh.world.BlockInstance;
import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.mesh.QuadData;
import com.voxelmesh.world.mesh.SectionMeshBuilder;
import org.joml.Vector3ic;

/**
 * Full cube with one texture per side. Visible faces go to the simple merger
 * of their side.
 */
public class SimpleMeshable implements BlockMeshable {

    private final int[] textures;
    private final TintMode tint;
    private final boolean animated;

    /**
     * @param textures texture per side: front, back, left, right, bottom, top
     */
    public SimpleMeshable(int[] textures, TintMode tint, boolean animated) {
        if (textures.length != 6) throw new IllegalArgumentException("Need six textures, got " + textures.length);
        this.textures = textures.clone();
        this.tint = tint;
        this.animated = animated;
    }

    public static SimpleMeshable uniform(int texture) {
        return new SimpleMeshable(new int[]{texture, texture, texture, texture, texture, texture}, TintMode.NONE, false);
    }

    public int getTexture(BlockSide side) {
        return textures[side.ordinal()];
    }

    @Override
    public void createMesh(Vector3ic position, BlockMeshInfo info, SectionMeshBuilder builder) {
        for (BlockSide side : BlockSide.sides()) {
            BlockInstance neighbor = builder.getBlock(position, side);
            if (isHiddenFace(info.block(), neighbor, side)) continue;

            addSimpleFace(position, side, getTexture(side), tint, animated, info.block().opaque(), builder);
        }
    }

    /**
     * Check whether a face of a full block is hidden by its neighbor. A missing
     * neighbor hides nothing. Non-opaque neighbors only hide faces of non-opaque
     * blocks, unless one of the two renders its faces at non-opaques.
     */
    public static boolean isHiddenFace(Block current, BlockInstance neighbor, BlockSide side) {
        if (neighbor == null) return false;

        Block other = neighbor.block();
        boolean consideredOpaque = other.opaque()
            || (!current.opaque() && !current.renderFaceAtNonOpaques() && !other.renderFaceAtNonOpaques());

        return consideredOpaque && neighbor.isSideFull(side.opposite());
    }

    static void addSimpleFace(Vector3ic position, BlockSide side, int texture, TintMode tint, boolean animated,
                              boolean opaque, SectionMeshBuilder builder) {
        int data = QuadData.texture(texture);
        data = QuadData.withAnimation(data, animated);
        if (tint == TintMode.NEUTRAL) data = QuadData.withTint(data, builder.getBlockTint(position));

        builder.getSimpleMerger(side, opaque).addFace(position, data);
    }
}
