package com.voxelmesh.world;

/**
 * The six axis-aligned sides of a block, section or chunk.
 * {@link #ALL} is a sentinel meaning "no single side" and has no direction.
 */
public enum BlockSide {
    FRONT(0, 0, 1, 'F'),
    BACK(0, 0, -1, 'B'),
    LEFT(-1, 0, 0, 'L'),
    RIGHT(1, 0, 0, 'R'),
    BOTTOM(0, -1, 0, 'D'),
    TOP(0, 1, 0, 'U'),
    ALL(0, 0, 0, '*');

    private static final BlockSide[] SIDES = {FRONT, BACK, LEFT, RIGHT, BOTTOM, TOP};

    private final int dx, dy, dz;
    private final char compact;

    BlockSide(int dx, int dy, int dz, char compact) {
        this.dx = dx;
        this.dy = dy;
        this.dz = dz;
        this.compact = compact;
    }

    /** The six real sides, in declaration order. Do not modify the returned array. */
    public static BlockSide[] sides() {
        return SIDES;
    }

    public int dx() { return dx; }
    public int dy() { return dy; }
    public int dz() { return dz; }

    public char toCompactChar() { return compact; }

    public BlockSide opposite() {
        return switch (this) {
            case FRONT -> BACK;
            case BACK -> FRONT;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case BOTTOM -> TOP;
            case TOP -> BOTTOM;
            case ALL -> ALL;
        };
    }

    /** The single bit of this side in a {@link Sides} set. ALL maps to every bit. */
    public int bit() {
        return this == ALL ? Sides.ALL_MASK : 1 << ordinal();
    }

    public Sides toFlag() {
        return Sides.of(this);
    }

    /** Find the side pointing in the given unit direction, or null if it is not a unit axis step. */
    public static BlockSide fromOffset(int x, int y, int z) {
        for (BlockSide side : SIDES) {
            if (side.dx == x && side.dy == y && side.dz == z) return side;
        }
        return null;
    }
}
