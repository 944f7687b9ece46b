package com.voxelmesh.world;

/**
 * Position dependent tint lookup (biome colors). Colors are packed {@code 0xRRGGBB}.
 * Implementations must be safe to call from meshing threads.
 */
public interface TintProvider {

    int getBlockTint(int x, int y, int z);

    int getFluidTint(int x, int y, int z);

    /** Constant grass green and water blue everywhere. */
    TintProvider NEUTRAL = new TintProvider() {
        @Override
        public int getBlockTint(int x, int y, int z) {
            return 0x5EBB3E;
        }

        @Override
        public int getFluidTint(int x, int y, int z) {
            return 0x3F76E4;
        }
    };
}
