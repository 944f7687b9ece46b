package com.voxelmesh.world.mesh.meshable;

import com.voxelmesh.world.mesh.BlockModel;
import com.voxelmesh.world.mesh.BlockModels;
import com.voxelmesh.world.mesh.QuadData;
import com.voxelmesh.world.mesh.SectionMeshBuilder;
import org.joml.Vector3f;
import org.joml.Vector3ic;

/**
 * Stand-in for blocks in a state their meshable rejects: a cross with the
 * missing texture, so the bad state stays visible and never breaks meshing.
 */
public final class ErrorMeshable implements BlockMeshable {

    public static final ErrorMeshable INSTANCE = new ErrorMeshable();

    private static final BlockModel MODEL = BlockModels.cross(QuadData.MISSING_TEXTURE);

    private ErrorMeshable() {}

    public static BlockModel getModel() {
        return MODEL;
    }

    @Override
    public void createMesh(Vector3ic position, BlockMeshInfo info, SectionMeshBuilder builder) {
        MODEL.push(
            builder.getBasicMeshing(true),
            new Vector3f(position.x(), position.y(), position.z()),
            data -> QuadData.withUnshaded(data, true));
    }
}
