package com.voxelmesh.world.mesh;

/**
 * Bit packing of the two per-quad words.
 *
 * Attribute word:
 * <pre>
 *   bits  0-12  texture index
 *   bit     13  animated
 *   bit     14  texture rotated
 *   bit     15  unshaded
 *   bits 16-24  tint, 3 bits per channel (r, g, b)
 *   bit     25  tint present
 * </pre>
 * Repetition word:
 * <pre>
 *   bits  0-3   texture repetition along the length, minus one
 *   bits  4-7   texture repetition along the height, minus one
 *   bits  8-11  face size in height units
 *   bits 12-16  skipped part in height units, plus one
 *   bit     17  face grows downwards
 *   bit     18  mirrored (back side of a double sided face)
 * </pre>
 */
public final class QuadData {

    public static final int MISSING_TEXTURE = 0;
    public static final int MAX_TEXTURE = (1 << 13) - 1;

    private static final int TEXTURE_MASK = MAX_TEXTURE;
    private static final int ANIMATED_BIT = 1 << 13;
    private static final int ROTATED_BIT = 1 << 14;
    private static final int UNSHADED_BIT = 1 << 15;
    private static final int TINT_SHIFT = 16;
    private static final int TINT_MASK = 0x1FF << TINT_SHIFT;
    private static final int TINT_PRESENT_BIT = 1 << 25;

    private static final int LENGTH_SHIFT = 0;
    private static final int HEIGHT_SHIFT = 4;
    private static final int REPETITION_MASK = 0xFF;
    private static final int SIZE_SHIFT = 8;
    private static final int SKIP_SHIFT = 12;
    private static final int DOWNWARDS_BIT = 1 << 17;
    private static final int MIRRORED_BIT = 1 << 18;

    private QuadData() {}

    // --- Attribute word ---

    public static int texture(int index) {
        if (index < 0 || index > MAX_TEXTURE) {
            throw new IllegalArgumentException("Texture index out of range: " + index);
        }
        return index;
    }

    /** Set the animation flag. Animation of the missing texture is never enabled. */
    public static int withAnimation(int data, boolean animated) {
        boolean actual = animated && getTexture(data) != MISSING_TEXTURE;
        return actual ? data | ANIMATED_BIT : data & ~ANIMATED_BIT;
    }

    public static int withRotation(int data, boolean rotated) {
        return rotated ? data | ROTATED_BIT : data & ~ROTATED_BIT;
    }

    public static int toggleRotation(int data) {
        return data ^ ROTATED_BIT;
    }

    public static int withUnshaded(int data, boolean unshaded) {
        return unshaded ? data | UNSHADED_BIT : data & ~UNSHADED_BIT;
    }

    /** Set the tint from a packed {@code 0xRRGGBB} color, reduced to 3 bits per channel. */
    public static int withTint(int data, int rgb) {
        int r = (rgb >> 21) & 0x7;
        int g = (rgb >> 13) & 0x7;
        int b = (rgb >> 5) & 0x7;
        int tint = (r << 6) | (g << 3) | b;
        return (data & ~TINT_MASK) | (tint << TINT_SHIFT) | TINT_PRESENT_BIT;
    }

    public static int withoutTint(int data) {
        return data & ~(TINT_MASK | TINT_PRESENT_BIT);
    }

    public static int getTexture(int data) {
        return data & TEXTURE_MASK;
    }

    public static boolean isAnimated(int data) {
        return (data & ANIMATED_BIT) != 0;
    }

    public static boolean isRotated(int data) {
        return (data & ROTATED_BIT) != 0;
    }

    public static boolean isUnshaded(int data) {
        return (data & UNSHADED_BIT) != 0;
    }

    public static boolean hasTint(int data) {
        return (data & TINT_PRESENT_BIT) != 0;
    }

    /** The reduced tint, expanded back to {@code 0xRRGGBB}. */
    public static int getTint(int data) {
        int tint = (data & TINT_MASK) >>> TINT_SHIFT;
        int r = (tint >> 6) & 0x7;
        int g = (tint >> 3) & 0x7;
        int b = tint & 0x7;
        return (expand(r) << 16) | (expand(g) << 8) | expand(b);
    }

    private static int expand(int channel) {
        return channel * 255 / 7;
    }

    // --- Repetition word ---

    /**
     * Set how often the texture repeats over a merged face. Length and height
     * count the blocks added to a single face, so zero means no repetition.
     * A rotated texture swaps the two.
     */
    public static int withRepetition(int uv, boolean rotated, int height, int length) {
        int l = rotated ? height : length;
        int h = rotated ? length : height;
        return (uv & ~REPETITION_MASK) | ((l & 0xF) << LENGTH_SHIFT) | ((h & 0xF) << HEIGHT_SHIFT);
    }

    /** Describe a partial height face, with size and skip in height units (skip -1 for none). */
    public static int withHeight(int uv, int size, int skip, boolean downwards) {
        int result = uv & REPETITION_MASK;
        result |= (size & 0xF) << SIZE_SHIFT;
        result |= ((skip + 1) & 0x1F) << SKIP_SHIFT;
        if (downwards) result |= DOWNWARDS_BIT;
        return result | (uv & MIRRORED_BIT);
    }

    public static int mirror(int uv) {
        return uv ^ MIRRORED_BIT;
    }

    public static int getLengthRepetition(int uv) {
        return (uv >> LENGTH_SHIFT) & 0xF;
    }

    public static int getHeightRepetition(int uv) {
        return (uv >> HEIGHT_SHIFT) & 0xF;
    }

    public static int getSize(int uv) {
        return (uv >> SIZE_SHIFT) & 0xF;
    }

    public static int getSkip(int uv) {
        return ((uv >> SKIP_SHIFT) & 0x1F) - 1;
    }

    public static boolean isDownwards(int uv) {
        return (uv & DOWNWARDS_BIT) != 0;
    }

    public static boolean isMirrored(int uv) {
        return (uv & MIRRORED_BIT) != 0;
    }
}
