package com.voxelmesh.world;

import org.joml.Vector3i;

/** Integer grid position of a section, in section units. */
public record SectionPos(int x, int y, int z) {

    public static SectionPos from(ChunkPos chunk, int localX, int localY, int localZ) {
        return new SectionPos(
            (chunk.x() << WorldConstants.CHUNK_SIZE_EXP) + localX,
            (chunk.y() << WorldConstants.CHUNK_SIZE_EXP) + localY,
            (chunk.z() << WorldConstants.CHUNK_SIZE_EXP) + localZ);
    }

    public static SectionPos fromIndex(ChunkPos chunk, int index) {
        int[] local = WorldConstants.indexToLocalSection(index);
        return from(chunk, local[0], local[1], local[2]);
    }

    public ChunkPos chunk() {
        return new ChunkPos(
            x >> WorldConstants.CHUNK_SIZE_EXP,
            y >> WorldConstants.CHUNK_SIZE_EXP,
            z >> WorldConstants.CHUNK_SIZE_EXP);
    }

    public int localX() { return x & (WorldConstants.CHUNK_SIZE - 1); }
    public int localY() { return y & (WorldConstants.CHUNK_SIZE - 1); }
    public int localZ() { return z & (WorldConstants.CHUNK_SIZE - 1); }

    /** Index of this section inside its chunk. */
    public int index() {
        return WorldConstants.localSectionToIndex(localX(), localY(), localZ());
    }

    public SectionPos offset(BlockSide side) {
        return new SectionPos(x + side.dx(), y + side.dy(), z + side.dz());
    }

    /** World position of the block at the section's origin corner. */
    public Vector3i firstBlock() {
        return new Vector3i(
            x << WorldConstants.SECTION_SIZE_EXP,
            y << WorldConstants.SECTION_SIZE_EXP,
            z << WorldConstants.SECTION_SIZE_EXP);
    }

    /**
     * Sides of the chunk this section touches. A section on the chunk border
     * needs the neighbor chunk on that side for a complete mesh.
     */
    public Sides requiredSides() {
        int last = WorldConstants.CHUNK_SIZE - 1;
        Sides required = Sides.NONE;
        if (localX() == 0) required = required.with(BlockSide.LEFT);
        if (localX() == last) required = required.with(BlockSide.RIGHT);
        if (localY() == 0) required = required.with(BlockSide.BOTTOM);
        if (localY() == last) required = required.with(BlockSide.TOP);
        if (localZ() == 0) required = required.with(BlockSide.BACK);
        if (localZ() == last) required = required.with(BlockSide.FRONT);
        return required;
    }
}
