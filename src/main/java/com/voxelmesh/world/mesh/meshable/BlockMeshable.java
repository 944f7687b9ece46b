package com.voxelmesh.world.mesh.meshable;

import com.voxelmesh.world.Block;
import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.mesh.SectionMeshBuilder;
import org.joml.Vector3ic;

/**
 * Turns a placed block into quads. Each block type is bound to one meshable,
 * which decides which faces are visible and where they go in the builder.
 */
public interface BlockMeshable {

    /**
     * Push the quads of the block at the given section-local position.
     * Neighbors are looked up through the builder; a missing neighbor is null
     * and hides nothing.
     */
    void createMesh(Vector3ic position, BlockMeshInfo info, SectionMeshBuilder builder);

    /** Whether a side of a block with this meshable completely covers the block face. */
    default boolean isSideFull(Block block, BlockSide side, int data) {
        return block.full();
    }

    /** Whether the block data is a state this meshable can mesh. */
    default boolean isValid(int data) {
        return true;
    }

    /** Meshable of blocks without geometry, such as air. */
    BlockMeshable NONE = (position, info, builder) -> {
    };
}
