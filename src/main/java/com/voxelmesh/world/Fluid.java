package com.voxelmesh.world;

import com.voxelmesh.world.mesh.SectionMeshBuilder;
import com.voxelmesh.world.mesh.meshable.FluidMeshable;
import com.voxelmesh.world.mesh.meshable.TintMode;
import org.joml.Vector3ic;

/**
 * Fluid type definition. Moving and static fluids may use different textures.
 */
public record Fluid(int id, String name, int movingTexture, int staticTexture,
                    TintMode tint, boolean rendered) {

    public int getTexture(boolean isStatic) {
        return isStatic ? staticTexture : movingTexture;
    }

    /** Push the faces of this fluid at the given section-local position. */
    public void createMesh(Vector3ic position, FluidInstance instance, BlockInstance block,
                           SectionMeshBuilder builder) {
        if (!rendered) return;
        FluidMeshable.createMesh(position, instance, block, builder);
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
