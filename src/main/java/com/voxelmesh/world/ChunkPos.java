package com.voxelmesh.world;

/** Integer grid position of a chunk. */
public record ChunkPos(int x, int y, int z) {

    public ChunkPos offset(BlockSide side) {
        return new ChunkPos(x + side.dx(), y + side.dy(), z + side.dz());
    }

    /**
     * The side on which {@code other} touches this chunk,
     * or null if it is this chunk or not a direct neighbor.
     */
    public BlockSide sideTowards(ChunkPos other) {
        return BlockSide.fromOffset(other.x - x, other.y - y, other.z - z);
    }

    /** Pack into a long key (21 bits per axis). */
    public long pack() {
        return ((long) (x & 0x1FFFFF) << 42) | ((long) (y & 0x1FFFFF) << 21) | (z & 0x1FFFFF);
    }
}
