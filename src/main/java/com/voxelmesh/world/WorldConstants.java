package com.voxelmesh.world;

/** Global world dimension constants. */
public final class WorldConstants {

    /** Blocks along one axis of a section. */
    public static final int SECTION_SIZE = 16;
    public static final int SECTION_SIZE_EXP = 4;
    public static final int SECTION_VOLUME = SECTION_SIZE * SECTION_SIZE * SECTION_SIZE; // 4096

    /** Sections along one axis of a chunk. */
    public static final int CHUNK_SIZE = 4;
    public static final int CHUNK_SIZE_EXP = 2;
    public static final int SECTION_COUNT = CHUNK_SIZE * CHUNK_SIZE * CHUNK_SIZE; // 64

    /** Blocks along one axis of a chunk. */
    public static final int CHUNK_BLOCK_SIZE = CHUNK_SIZE * SECTION_SIZE;

    private WorldConstants() {}

    /** Convert a local section coordinate triple to its index inside a chunk. */
    public static int localSectionToIndex(int x, int y, int z) {
        return (x << (CHUNK_SIZE_EXP * 2)) + (y << CHUNK_SIZE_EXP) + z;
    }

    /** Inverse of {@link #localSectionToIndex(int, int, int)}, as {x, y, z}. */
    public static int[] indexToLocalSection(int index) {
        int z = index & (CHUNK_SIZE - 1);
        int y = (index >> CHUNK_SIZE_EXP) & (CHUNK_SIZE - 1);
        int x = (index >> (CHUNK_SIZE_EXP * 2)) & (CHUNK_SIZE - 1);
        return new int[]{x, y, z};
    }

    public static boolean isInSection(int x, int y, int z) {
        return x >= 0 && x < SECTION_SIZE
            && y >= 0 && y < SECTION_SIZE
            && z >= 0 && z < SECTION_SIZE;
    }
}
