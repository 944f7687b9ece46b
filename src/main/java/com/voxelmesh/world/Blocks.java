package com.voxelmesh.world;

import com.voxelmesh.world.mesh.BlockModels;
import com.voxelmesh.world.mesh.meshable.BlockMeshable;
import com.voxelmesh.world.mesh.meshable.ComplexMeshable;
import com.voxelmesh.world.mesh.meshable.FoliageMeshable;
import com.voxelmesh.world.mesh.meshable.SimpleMeshable;
import com.voxelmesh.world.mesh.meshable.TintMode;
import com.voxelmesh.world.mesh.meshable.VaryingHeightMeshable;

/**
 * Block registry. Ids index into {@link #byId(int)}; id 0 is air.
 *
 * Texture order for simple blocks: [front, back, left, right, bottom, top].
 */
public final class Blocks {

    public static final Block AIR = new Block(0, "air", false, false, false, BlockMeshable.NONE);

    public static final Block STONE = new Block(1, "stone", true, true, false,
        SimpleMeshable.uniform(1));
    public static final Block DIRT = new Block(2, "dirt", true, true, false,
        SimpleMeshable.uniform(2));
    public static final Block GRASS = new Block(3, "grass", true, true, false,
        new SimpleMeshable(new int[]{3, 3, 3, 3, 2, 4}, TintMode.NEUTRAL, false));
    public static final Block GLASS = new Block(4, "glass", false, true, false,
        SimpleMeshable.uniform(5));
    public static final Block LEAVES = new Block(5, "leaves", false, true, true,
        new SimpleMeshable(new int[]{6, 6, 6, 6, 6, 6}, TintMode.NEUTRAL, false));
    public static final Block SNOW = new Block(6, "snow", true, true, false,
        new VaryingHeightMeshable(7, TintMode.NONE));
    public static final Block TALL_GRASS = new Block(7, "tall_grass", false, false, false,
        new FoliageMeshable(FoliageMeshable.Layout.CROSS, 8, TintMode.NEUTRAL, false));
    public static final Block WHEAT = new Block(8, "wheat", false, false, false,
        new FoliageMeshable(FoliageMeshable.Layout.DENSE_CROP, 9, TintMode.NONE, false));
    public static final Block FENCE_POST = new Block(9, "fence_post", false, false, false,
        new ComplexMeshable(BlockModels.box(0.375f, 0.0f, 0.375f, 0.625f, 1.0f, 0.625f, 10)));
    public static final Block MAGMA = new Block(10, "magma", true, true, false,
        new SimpleMeshable(new int[]{11, 11, 11, 11, 11, 11}, TintMode.NONE, true));

    private static final Block[] BY_ID = {
        AIR, STONE, DIRT, GRASS, GLASS, LEAVES, SNOW, TALL_GRASS, WHEAT, FENCE_POST, MAGMA
    };

    private Blocks() {}

    public static Block byId(int id) {
        if (id < 0 || id >= BY_ID.length) return AIR;
        return BY_ID[id];
    }

    public static int count() {
        return BY_ID.length;
    }
}
