package com.voxelmesh.world;

/** A block together with the attribute data of one placed instance. */
public record BlockInstance(Block block, int data) {

    public boolean isOpaque() {
        return block.opaque();
    }

    public boolean isSideFull(BlockSide side) {
        return block.isSideFull(side, data);
    }
}
