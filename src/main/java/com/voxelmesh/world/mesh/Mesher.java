package com.voxelmesh.world.mesh;

import com.voxelmesh.world.SectionPos;
import com.voxelmesh.world.Sides;

/**
 * Meshing contract. Converts section block data into renderable quads,
 * reading neighbors through a {@link ChunkMeshingContext}.
 * Safe to call from any thread that may use the context.
 */
public interface Mesher {

    /**
     * Build the mesh of one section.
     *
     * @param context  access to the chunk of the section and its neighbors
     * @param position a section of the context's chunk
     * @return the section mesh, owned by the caller
     */
    SectionMeshData meshSection(ChunkMeshingContext context, SectionPos position);

    /**
     * Build the meshes of all sections the context covers.
     *
     * @param previouslyMeshed the sides the current mesh of the chunk reflects
     * @return the chunk mesh, owned by the caller
     */
    ChunkMeshData meshChunk(ChunkMeshingContext context, Sides previouslyMeshed);
}
