package com.voxelmesh.world;

import com.voxelmesh.world.mesh.meshable.BlockMeshable;

/**
 * Block type definition: id, name, visibility properties and the meshable
 * that turns a placed block into quads.
 *
 * Opaque blocks hide the faces of their neighbors where they are full.
 * Non-opaque blocks only hide faces of other non-opaque blocks, unless one of
 * the two asks to render faces at non-opaques (leaves next to glass).
 */
public record Block(int id, String name, boolean opaque, boolean full,
                    boolean renderFaceAtNonOpaques, BlockMeshable meshable) {

    /** Whether the given side of a placed block completely covers the block face. */
    public boolean isSideFull(BlockSide side, int data) {
        return meshable.isSideFull(this, side, data);
    }

    /** Whether the block data is a state this block accepts. */
    public boolean isValidData(int data) {
        return meshable.isValid(data);
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
