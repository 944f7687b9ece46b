package com.voxelmesh.world;

import java.util.Arrays;

/**
 * A 16×16×16 cube of blocks. Each position stores one packed word:
 *
 * <pre>
 *   bits  0-11  block id
 *   bits 12-17  block data
 *   bits 18-22  fluid id
 *   bits 23-25  fluid level - 1
 *   bit  26     fluid is static
 * </pre>
 *
 * A freshly created section is air with no fluid, which packs to 0 except for the level bits.
 * Reads are not synchronized; callers hold read access to the owning chunk.
 */
public class Section {

    private static final int BLOCK_MASK = 0xFFF;
    private static final int DATA_SHIFT = 12;
    private static final int DATA_MASK = 0x3F;
    private static final int FLUID_SHIFT = 18;
    private static final int FLUID_MASK = 0x1F;
    private static final int LEVEL_SHIFT = 23;
    private static final int LEVEL_MASK = 0x7;
    private static final int STATIC_SHIFT = 26;

    /** Largest block data value that fits the packed word. */
    public static final int MAX_DATA = DATA_MASK;

    private static final int EMPTY = encode(Blocks.AIR, 0, Fluids.NONE, FluidInstance.MAX_LEVEL, true);

    private final int[] blocks = new int[WorldConstants.SECTION_VOLUME];

    public Section() {
        Arrays.fill(blocks, EMPTY);
    }

    private static int index(int x, int y, int z) {
        return (x << (WorldConstants.SECTION_SIZE_EXP * 2)) + (y << WorldConstants.SECTION_SIZE_EXP) + z;
    }

    public static int encode(Block block, int data, Fluid fluid, int level, boolean isStatic) {
        if (data < 0 || data > MAX_DATA) throw new IllegalArgumentException("Block data out of range: " + data);
        if (level < 1 || level > FluidInstance.MAX_LEVEL) throw new IllegalArgumentException("Fluid level out of range: " + level);
        return (block.id() & BLOCK_MASK)
            | (data << DATA_SHIFT)
            | ((fluid.id() & FLUID_MASK) << FLUID_SHIFT)
            | ((level - 1) << LEVEL_SHIFT)
            | ((isStatic ? 1 : 0) << STATIC_SHIFT);
    }

    public static Block decodeBlock(int word) {
        return Blocks.byId(word & BLOCK_MASK);
    }

    public static int decodeData(int word) {
        return (word >>> DATA_SHIFT) & DATA_MASK;
    }

    public static Fluid decodeFluid(int word) {
        return Fluids.byId((word >>> FLUID_SHIFT) & FLUID_MASK);
    }

    public static int decodeLevel(int word) {
        return ((word >>> LEVEL_SHIFT) & LEVEL_MASK) + 1;
    }

    public static boolean decodeStatic(int word) {
        return ((word >>> STATIC_SHIFT) & 1) != 0;
    }

    /** Raw packed word at section-local coordinates. */
    public int getWord(int x, int y, int z) {
        return blocks[index(x, y, z)];
    }

    public BlockInstance getBlock(int x, int y, int z) {
        int word = blocks[index(x, y, z)];
        return new BlockInstance(decodeBlock(word), decodeData(word));
    }

    public FluidInstance getFluid(int x, int y, int z) {
        int word = blocks[index(x, y, z)];
        Fluid fluid = decodeFluid(word);
        if (fluid == Fluids.NONE) return FluidInstance.NONE;
        return new FluidInstance(fluid, decodeLevel(word), decodeStatic(word));
    }

    public void setBlock(int x, int y, int z, Block block, int data) {
        int idx = index(x, y, z);
        int word = blocks[idx];
        blocks[idx] = encode(block, data, decodeFluid(word), decodeLevel(word), decodeStatic(word));
    }

    public void setFluid(int x, int y, int z, Fluid fluid, int level, boolean isStatic) {
        int idx = index(x, y, z);
        int word = blocks[idx];
        blocks[idx] = encode(decodeBlock(word), decodeData(word), fluid, level, isStatic);
    }

    /** Whether every position is air without fluid. */
    public boolean isEmpty() {
        for (int word : blocks) {
            if (word != EMPTY) return false;
        }
        return true;
    }
}
