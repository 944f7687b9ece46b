package com.voxelmesh.world.mesh.meshable;

import com.voxelmesh.world.mesh.BlockModel;
import com.voxelmesh.world.mesh.SectionMeshBuilder;
import org.joml.Vector3f;
import org.joml.Vector3ic;

/** Block with an arbitrary model, pushed unmerged into the basic sink. */
public class ComplexMeshable implements BlockMeshable {

    private final BlockModel model;

    public ComplexMeshable(BlockModel model) {
        this.model = model;
    }

    public BlockModel getModel() {
        return model;
    }

    @Override
    public void createMesh(Vector3ic position, BlockMeshInfo info, SectionMeshBuilder builder) {
        model.push(
            builder.getBasicMeshing(info.block().opaque()),
            new Vector3f(position.x(), position.y(), position.z()),
            data -> data);
    }
}
