package com.voxelmesh.world.mesh.meshable;

import com.voxelmesh.world.BlockInstance;
import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.Fluid;
import com.voxelmesh.world.FluidInstance;
import com.voxelmesh.world.mesh.MeshFaceMerger;
import com.voxelmesh.world.mesh.QuadData;
import com.voxelmesh.world.mesh.SectionMeshBuilder;
import org.joml.Vector3ic;

/**
 * Fluid faces, merged through the fluid mergers. Fluids flow downwards, so
 * their faces start at the bottom of the block.
 *
 * <p>A lateral face is culled by an opaque full neighbor, or by the same fluid
 * at an equal or higher level. A lower level of the same fluid next to it
 * covers the bottom part of the face, which is skipped.
 */
public final class FluidMeshable {

    private FluidMeshable() {}

    public static void createMesh(Vector3ic position, FluidInstance instance, BlockInstance block,
                                  SectionMeshBuilder builder) {
        if (block.isOpaque() && block.block().full()) return;

        Fluid fluid = instance.fluid();

        for (BlockSide side : BlockSide.sides()) {
            BlockInstance neighborBlock = builder.getBlock(position, side);
            FluidInstance neighborFluid = builder.getFluid(position, side);

            boolean coveredByBlock = neighborBlock != null
                && neighborBlock.isOpaque()
                && neighborBlock.isSideFull(side.opposite());
            boolean sameFluid = neighborFluid != null && neighborFluid.fluid() == fluid;

            int sideLevel = sameFluid && !coveredByBlock ? neighborFluid.level() : 0;

            boolean visible = switch (side) {
                case TOP -> instance.level() != FluidInstance.MAX_LEVEL || (!sameFluid && !coveredByBlock);
                case BOTTOM -> sideLevel != FluidInstance.MAX_LEVEL && !coveredByBlock;
                default -> instance.level() > sideLevel && !coveredByBlock;
            };

            if (!visible) continue;

            int data = QuadData.texture(fluid.getTexture(instance.isStatic()));
            data = QuadData.withAnimation(data, true);
            if (fluid.tint() == TintMode.NEUTRAL) data = QuadData.withTint(data, builder.getFluidTint(position));

            int skip = sideLevel == 0 ? MeshFaceMerger.NO_HEIGHT : sideLevel * 2 - 1;

            builder.getFluidMerger(side).addFace(
                position,
                instance.height(),
                skip,
                true,
                data,
                coveredByBlock,
                instance.level() == FluidInstance.MAX_LEVEL);
        }
    }
}
