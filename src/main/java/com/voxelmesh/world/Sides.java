package com.voxelmesh.world;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable set of the six {@link BlockSide}s, stored as a 6-bit mask.
 */
public record Sides(int mask) {

    static final int ALL_MASK = 0b111111;

    public static final Sides NONE = new Sides(0);
    public static final Sides ALL = new Sides(ALL_MASK);

    public Sides {
        if ((mask & ~ALL_MASK) != 0) {
            throw new IllegalArgumentException("Invalid side mask: " + Integer.toBinaryString(mask));
        }
    }

    public static Sides of(BlockSide... sides) {
        int mask = 0;
        for (BlockSide side : sides) mask |= side.bit();
        return new Sides(mask);
    }

    public boolean contains(BlockSide side) {
        return side != BlockSide.ALL && (mask & side.bit()) != 0;
    }

    /** Whether every side of {@code other} is also in this set. */
    public boolean containsAll(Sides other) {
        return (mask & other.mask) == other.mask;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public int count() {
        return Integer.bitCount(mask);
    }

    public Sides with(BlockSide side) {
        return new Sides(mask | side.bit());
    }

    public Sides without(BlockSide side) {
        return new Sides(mask & ~side.bit());
    }

    public Sides union(Sides other) {
        return new Sides(mask | other.mask);
    }

    public Sides intersect(Sides other) {
        return new Sides(mask & other.mask);
    }

    public Sides minus(Sides other) {
        return new Sides(mask & ~other.mask);
    }

    /** The only side in this set. Fails if the set does not hold exactly one side. */
    public BlockSide single() {
        if (count() != 1) throw new IllegalStateException("Not a single side: " + toCompactString());
        return BlockSide.sides()[Integer.numberOfTrailingZeros(mask)];
    }

    public List<BlockSide> toList() {
        List<BlockSide> list = new ArrayList<>(count());
        for (BlockSide side : BlockSide.sides()) {
            if (contains(side)) list.add(side);
        }
        return list;
    }

    /** Compact form such as {@code FBLR--}, one character per side in declaration order. */
    public String toCompactString() {
        StringBuilder sb = new StringBuilder(6);
        for (BlockSide side : BlockSide.sides()) {
            sb.append(contains(side) ? side.toCompactChar() : '-');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "[" + toCompactString() + "]";
    }
}
