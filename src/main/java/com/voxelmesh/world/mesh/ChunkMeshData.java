package com.voxelmesh.world.mesh;

import com.voxelmesh.world.ChunkPos;
import com.voxelmesh.world.Sides;
import com.voxelmesh.world.WorldConstants;

import java.util.Arrays;

/**
 * The result of one meshing attempt for a chunk: the section meshes of the
 * included sections, and the sides the mesh now reflects.
 * Owns the section meshes until they are taken; disposing it disposes what is left.
 */
public final class ChunkMeshData {

    private final ChunkPos chunk;
    private final SectionMeshData[] sections;
    private final Sides sides;
    private final int[] indices;

    private boolean disposed;

    /**
     * @param sections section meshes by section index, null where not meshed in this attempt
     * @param indices  the section indices that were meshed
     */
    public ChunkMeshData(ChunkPos chunk, SectionMeshData[] sections, Sides sides, int[] indices) {
        if (sections.length != WorldConstants.SECTION_COUNT) {
            throw new IllegalArgumentException("Expected " + WorldConstants.SECTION_COUNT + " sections, got " + sections.length);
        }
        this.chunk = chunk;
        this.sections = sections;
        this.sides = sides;
        this.indices = indices.clone();
    }

    public ChunkPos getChunk() {
        return chunk;
    }

    public Sides getSides() {
        return sides;
    }

    public int[] getIndices() {
        return indices.clone();
    }

    public SectionMeshData getSection(int index) {
        checkNotDisposed();
        return sections[index];
    }

    /** Transfer ownership of one section mesh to the caller. */
    public SectionMeshData takeSection(int index) {
        checkNotDisposed();
        SectionMeshData section = sections[index];
        sections[index] = null;
        return section;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /** Dispose all section meshes not taken yet. Further calls do nothing. */
    public void dispose() {
        if (disposed) return;
        disposed = true;

        for (int i = 0; i < sections.length; i++) {
            if (sections[i] != null) {
                sections[i].dispose();
                sections[i] = null;
            }
        }
    }

    private void checkNotDisposed() {
        if (disposed) throw new IllegalStateException("Mesh data of " + chunk + " is disposed");
    }

    @Override
    public String toString() {
        return "ChunkMeshData[" + chunk + ", sides=" + sides.toCompactString()
            + ", sections=" + Arrays.toString(indices) + "]";
    }
}
