package com.voxelmesh.world.mesh;

import com.voxelmesh.world.ChunkPos;
import com.voxelmesh.world.SectionPos;
import com.voxelmesh.world.Sides;
import com.voxelmesh.world.WorldConstants;

/**
 * {@link Mesher} running one {@link SectionMeshBuilder} per section.
 */
public class SectionMesher implements Mesher {

    private final MeshingConfig config;

    public SectionMesher(MeshingConfig config) {
        this.config = config;
    }

    public MeshingConfig getConfig() {
        return config;
    }

    @Override
    public SectionMeshData meshSection(ChunkMeshingContext context, SectionPos position) {
        return new SectionMeshBuilder(position, context, config).build();
    }

    @Override
    public ChunkMeshData meshChunk(ChunkMeshingContext context, Sides previouslyMeshed) {
        ChunkPos chunk = context.getChunk().getPos();
        SectionMeshData[] sections = new SectionMeshData[WorldConstants.SECTION_COUNT];
        boolean completed = false;

        try {
            for (int index : context.getSectionIndices()) {
                sections[index] = meshSection(context, SectionPos.fromIndex(chunk, index));
            }
            completed = true;
        } finally {
            if (!completed) {
                for (SectionMeshData section : sections) {
                    if (section != null) section.dispose();
                }
            }
        }

        return context.createMeshData(sections, previouslyMeshed);
    }
}
