package com.voxelmesh.world;

import com.voxelmesh.world.mesh.ChunkMeshData;
import com.voxelmesh.world.mesh.SectionMeshData;

import java.util.Arrays;

/**
 * A cube of {@link WorldConstants#CHUNK_SIZE}³ sections. The unit of world
 * streaming and of guard based access control.
 *
 * Block data is read through guards from {@link #acquireCore(Access)}.
 * Mesh bookkeeping (meshed sides, current section meshes, incomplete sections)
 * belongs to the owning thread of the world.
 */
public class Chunk {

    private final ChunkPos pos;
    private final World world;
    private final Section[] sections;
    private final CoreLock core;

    private volatile boolean fullyDecorated;
    private volatile boolean requestedToActivate;
    private volatile boolean active;
    private volatile boolean disposed;

    // Owning thread only.
    private boolean hasMeshData;
    private Sides meshedSides = Sides.NONE;
    private final SectionMeshData[] sectionMeshes = new SectionMeshData[WorldConstants.SECTION_COUNT];
    private final Sides[] missingSides = new Sides[WorldConstants.SECTION_COUNT];

    public Chunk(World world, ChunkPos pos) {
        this.world = world;
        this.pos = pos;
        this.core = new CoreLock(this);
        this.sections = new Section[WorldConstants.SECTION_COUNT];
        for (int i = 0; i < sections.length; i++) sections[i] = new Section();
        Arrays.fill(missingSides, Sides.NONE);
    }

    public ChunkPos getPos() { return pos; }
    public World getWorld() { return world; }

    // --- Sections and blocks ---

    public Section getSection(int index) {
        return sections[index];
    }

    public Section getLocalSection(int x, int y, int z) {
        return sections[WorldConstants.localSectionToIndex(x, y, z)];
    }

    /** Get a section of this chunk by its world section position. */
    public Section getSection(SectionPos position) {
        if (!position.chunk().equals(pos)) {
            throw new IllegalArgumentException("Section " + position + " is not part of chunk " + pos);
        }
        return sections[position.index()];
    }

    /** Set a block at chunk-local block coordinates. Caller holds write access. */
    public void setBlock(int x, int y, int z, Block block, int data) {
        sectionAt(x, y, z).setBlock(
            x & (WorldConstants.SECTION_SIZE - 1),
            y & (WorldConstants.SECTION_SIZE - 1),
            z & (WorldConstants.SECTION_SIZE - 1),
            block, data);
    }

    /** Set a fluid at chunk-local block coordinates. Caller holds write access. */
    public void setFluid(int x, int y, int z, Fluid fluid, int level, boolean isStatic) {
        sectionAt(x, y, z).setFluid(
            x & (WorldConstants.SECTION_SIZE - 1),
            y & (WorldConstants.SECTION_SIZE - 1),
            z & (WorldConstants.SECTION_SIZE - 1),
            fluid, level, isStatic);
    }

    public BlockInstance getBlock(int x, int y, int z) {
        return sectionAt(x, y, z).getBlock(
            x & (WorldConstants.SECTION_SIZE - 1),
            y & (WorldConstants.SECTION_SIZE - 1),
            z & (WorldConstants.SECTION_SIZE - 1));
    }

    private Section sectionAt(int x, int y, int z) {
        if (x < 0 || x >= WorldConstants.CHUNK_BLOCK_SIZE ||
            y < 0 || y >= WorldConstants.CHUNK_BLOCK_SIZE ||
            z < 0 || z >= WorldConstants.CHUNK_BLOCK_SIZE) {
            throw new IndexOutOfBoundsException("Block (" + x + ", " + y + ", " + z + ") outside chunk " + pos);
        }
        return getLocalSection(
            x >> WorldConstants.SECTION_SIZE_EXP,
            y >> WorldConstants.SECTION_SIZE_EXP,
            z >> WorldConstants.SECTION_SIZE_EXP);
    }

    // --- Core access ---

    /** Try to get access to the core data. Never blocks; returns null if unavailable or disposed. */
    public Guard acquireCore(Access access) {
        if (disposed) return null;
        return core.tryAcquire(access);
    }

    /** Non-blocking probe for {@link #acquireCore(Access)}. */
    public boolean canAcquireCore(Access access) {
        return !disposed && core.canAcquire(access);
    }

    public CoreLock getCoreLock() {
        return core;
    }

    // --- Lifecycle flags ---

    public boolean isFullyDecorated() { return fullyDecorated; }
    public void setFullyDecorated(boolean decorated) { this.fullyDecorated = decorated; }

    public boolean isRequestedToActivate() { return requestedToActivate; }
    public void setRequestedToActivate(boolean requested) { this.requestedToActivate = requested; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public boolean isDisposed() { return disposed; }

    /**
     * Whether this chunk can take part in meshing as a neighbor:
     * alive, fully generated and still wanted by streaming.
     */
    public boolean isViable() {
        return !disposed && fullyDecorated && requestedToActivate;
    }

    // --- Mesh bookkeeping (owning thread) ---

    public boolean hasMeshData() {
        return hasMeshData;
    }

    /** Sides at which the current mesh reflects the neighbor. */
    public Sides getMeshedSides() {
        return meshedSides;
    }

    public SectionMeshData getSectionMesh(int index) {
        return sectionMeshes[index];
    }

    /** Sides whose neighbor was missing when the section at the index was last meshed. */
    public Sides getMissingSides(int index) {
        return missingSides[index];
    }

    /**
     * Take over the section meshes of a finished meshing attempt.
     * Replaced section meshes are disposed. Entries not taken stay owned by
     * {@code meshData}, which is disposed here.
     */
    public void setMeshData(ChunkMeshData meshData) {
        world.requireOwningThread("apply mesh data");
        if (disposed) throw new IllegalStateException("Chunk " + pos + " is disposed");
        if (!meshData.getChunk().equals(pos)) {
            throw new IllegalStateException("Mesh data of " + meshData.getChunk() + " applied to chunk " + pos);
        }

        for (int index : meshData.getIndices()) {
            SectionMeshData section = meshData.takeSection(index);
            if (section == null) continue;
            Sides required = SectionPos.fromIndex(pos, index).requiredSides();
            replaceSectionMesh(index, section, required.minus(meshData.getSides()));
        }

        hasMeshData = true;
        meshedSides = meshData.getSides();
        meshData.dispose();
    }

    /** Replace the mesh of one section, for example when recreating an incomplete one. */
    public void setSectionMesh(int index, SectionMeshData section, Sides missing) {
        world.requireOwningThread("apply section mesh");
        replaceSectionMesh(index, section, missing);
    }

    private void replaceSectionMesh(int index, SectionMeshData section, Sides missing) {
        SectionMeshData previous = sectionMeshes[index];
        if (previous != null && previous != section) previous.dispose();
        sectionMeshes[index] = section;
        missingSides[index] = missing;
    }

    /** Mark a section as needing the given sides, e.g. after a data change it was not re-meshed for. */
    public void markSectionIncomplete(int index, Sides sides) {
        world.requireOwningThread("mark section incomplete");
        missingSides[index] = missingSides[index].union(sides);
    }

    public void dispose() {
        disposed = true;
        active = false;
        for (int i = 0; i < sectionMeshes.length; i++) {
            if (sectionMeshes[i] != null) {
                sectionMeshes[i].dispose();
                sectionMeshes[i] = null;
            }
        }
    }

    @Override
    public String toString() {
        return "Chunk(" + pos.x() + ", " + pos.y() + ", " + pos.z() + ")";
    }
}
