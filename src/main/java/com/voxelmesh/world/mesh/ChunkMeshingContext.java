package com.voxelmesh.world.mesh;

import com.voxelmesh.world.Access;
import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.Chunk;
import com.voxelmesh.world.ChunkPos;
import com.voxelmesh.world.Guard;
import com.voxelmesh.world.Section;
import com.voxelmesh.world.SectionPos;
import com.voxelmesh.world.Sides;
import com.voxelmesh.world.World;
import com.voxelmesh.world.WorldConstants;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The neighbor access of one meshing attempt for a chunk.
 *
 * <p>Background meshing uses {@link #acquire}, which takes read guards on the
 * neighbor chunks without ever blocking. Meshing on the owning thread uses
 * {@link #usingActive}, which needs no guards. The center chunk is never guarded
 * here: the caller must already have sufficient access to it.
 *
 * <p>An attempt may be exclusive to one side. It then only meshes the sections
 * touching that side and does not need the neighbor on the opposite side.
 *
 * <p>Every context must be released, on every path.
 */
public final class ChunkMeshingContext implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ChunkMeshingContext.class.getName());

    private static final int[][] SIDE_SECTIONS = new int[6][];
    private static final int[] ALL_SECTIONS = new int[WorldConstants.SECTION_COUNT];

    static {
        int last = WorldConstants.CHUNK_SIZE - 1;
        int perSide = WorldConstants.CHUNK_SIZE * WorldConstants.CHUNK_SIZE;
        int[] filled = new int[6];
        for (int i = 0; i < 6; i++) SIDE_SECTIONS[i] = new int[perSide];

        for (int index = 0; index < WorldConstants.SECTION_COUNT; index++) {
            ALL_SECTIONS[index] = index;

            int[] local = WorldConstants.indexToLocalSection(index);
            if (local[0] == 0) addSideSection(BlockSide.LEFT, index, filled);
            if (local[0] == last) addSideSection(BlockSide.RIGHT, index, filled);
            if (local[1] == 0) addSideSection(BlockSide.BOTTOM, index, filled);
            if (local[1] == last) addSideSection(BlockSide.TOP, index, filled);
            if (local[2] == 0) addSideSection(BlockSide.BACK, index, filled);
            if (local[2] == last) addSideSection(BlockSide.FRONT, index, filled);
        }
    }

    private static void addSideSection(BlockSide side, int index, int[] filled) {
        SIDE_SECTIONS[side.ordinal()][filled[side.ordinal()]++] = index;
    }

    /** A neighbor slot: either nothing usable, or a chunk with the guard held on it (null when unguarded). */
    public sealed interface Neighbor permits Unavailable, Available {
    }

    public record Unavailable() implements Neighbor {
        static final Unavailable INSTANCE = new Unavailable();
    }

    public record Available(Chunk chunk, Guard guard) implements Neighbor {
    }

    /**
     * Result of probing the neighbors without acquiring anything.
     *
     * @param considered sides with a viable neighbor
     * @param acquirable considered sides whose neighbor could be read right now
     * @param complete   false if the probe stopped at a side that was not acquirable
     */
    public record NeighborAvailability(Sides considered, Sides acquirable, boolean complete) {
    }

    private final Chunk chunk;
    private final Neighbor[] neighbors;
    private final Sides availableSides;
    private final BlockSide exclusiveSide;
    private final MeshingFactory meshingFactory;

    private boolean released;

    private ChunkMeshingContext(Chunk chunk, Neighbor[] neighbors, Sides availableSides,
                                BlockSide exclusiveSide, MeshingFactory meshingFactory) {
        this.chunk = chunk;
        this.neighbors = neighbors;
        this.availableSides = availableSides;
        this.exclusiveSide = exclusiveSide;
        this.meshingFactory = meshingFactory;
    }

    // --- Acquisition ---

    /**
     * Acquire the neighbors for background meshing. Never blocks; neighbors that
     * are absent, not viable or not readable right now are left out.
     *
     * @param meshedSides   the sides the current mesh of the chunk reflects
     * @param requestSource the side of the neighbor that asked for this attempt, or {@link BlockSide#ALL}
     */
    public static ChunkMeshingContext acquire(Chunk chunk, Sides meshedSides, BlockSide requestSource,
                                              MeshingFactory meshingFactory) {
        Sides notAcquirable = Sides.NONE;
        BlockSide exclusive = BlockSide.ALL;

        if (requestSource != BlockSide.ALL) {
            NeighborAvailability availability = checkNeighbors(chunk, true);
            notAcquirable = availability.considered().minus(availability.acquirable());
            exclusive = chooseExclusiveSide(requestSource, meshedSides,
                availability.considered(), availability.acquirable());
        }

        World world = chunk.getWorld();
        Neighbor[] neighbors = new Neighbor[6];
        Sides available = Sides.NONE;

        for (BlockSide side : BlockSide.sides()) {
            neighbors[side.ordinal()] = Unavailable.INSTANCE;

            if (notAcquirable.contains(side)) continue;
            if (exclusive != BlockSide.ALL && side == exclusive.opposite()) continue;

            Chunk neighbor = world.tryGetChunk(chunk.getPos().offset(side));
            if (neighbor == null || !neighbor.isViable()) continue;

            Guard guard = neighbor.acquireCore(Access.READ);
            if (guard == null) continue;

            neighbors[side.ordinal()] = new Available(neighbor, guard);
            available = available.with(side);
        }

        ChunkMeshingContext context = new ChunkMeshingContext(chunk, neighbors, available, exclusive, meshingFactory);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("[Meshing] Acquired " + context + " for " + chunk + " (requested by "
                + requestSource.toCompactChar() + ", meshed " + meshedSides + ")");
        }

        return context;
    }

    /**
     * Use the active neighbors of a chunk, without guards. Only allowed on the
     * owning thread of the world. Always meshes the whole chunk.
     */
    public static ChunkMeshingContext usingActive(Chunk chunk, MeshingFactory meshingFactory) {
        World world = chunk.getWorld();
        world.requireOwningThread("mesh using active chunks");

        Neighbor[] neighbors = new Neighbor[6];
        Sides available = Sides.NONE;

        for (BlockSide side : BlockSide.sides()) {
            neighbors[side.ordinal()] = Unavailable.INSTANCE;

            Chunk neighbor = world.getActiveChunk(chunk.getPos().offset(side));
            if (neighbor == null || !neighbor.isViable()) continue;

            neighbors[side.ordinal()] = new Available(neighbor, null);
            available = available.with(side);
        }

        return new ChunkMeshingContext(chunk, neighbors, available, BlockSide.ALL, meshingFactory);
    }

    /**
     * Probe the neighbors of a chunk without acquiring anything.
     *
     * @param abortEarly stop at the first viable side that is not acquirable
     */
    public static NeighborAvailability checkNeighbors(Chunk chunk, boolean abortEarly) {
        World world = chunk.getWorld();
        Sides considered = Sides.NONE;
        Sides acquirable = Sides.NONE;

        for (BlockSide side : BlockSide.sides()) {
            Chunk neighbor = world.tryGetChunk(chunk.getPos().offset(side));
            if (neighbor == null || !neighbor.isViable()) continue;

            considered = considered.with(side);

            if (neighbor.canAcquireCore(Access.READ)) {
                acquirable = acquirable.with(side);
            } else if (abortEarly) {
                return new NeighborAvailability(considered, acquirable, false);
            }
        }

        return new NeighborAvailability(considered, acquirable, considered.equals(acquirable));
    }

    /**
     * Decide whether an attempt requested by a neighbor is exclusive to that side.
     * A full mesh is used when nothing was meshed yet, or when the chunk is already
     * meshed towards every considered side apart from the requesting one and all
     * considered sides are acquirable.
     *
     * @return the exclusive side, or {@link BlockSide#ALL} for a full attempt
     */
    public static BlockSide chooseExclusiveSide(BlockSide requestSource, Sides meshedSides,
                                                Sides considered, Sides acquirable) {
        if (requestSource == BlockSide.ALL) return BlockSide.ALL;

        // Without any meshed side, a single side would leave the inner sections unmeshed.
        if (meshedSides.isEmpty()) return BlockSide.ALL;

        boolean covered = meshedSides.with(requestSource).containsAll(considered);
        boolean noImprovement = covered && considered.equals(acquirable);

        return noImprovement ? BlockSide.ALL : requestSource;
    }

    /**
     * Sides a finished attempt may record as meshed. A full attempt records the
     * sides that were available. An exclusive attempt keeps a previously meshed
     * side only while it is still available, adds the exclusive side if it was
     * available, and keeps the opposite side as it was, since none of its sections were touched.
     */
    public static Sides computeMeshedSides(Sides available, Sides previouslyMeshed, BlockSide exclusive) {
        if (exclusive == BlockSide.ALL) return available;

        Sides sides = available.intersect(previouslyMeshed)
            .union(available.intersect(exclusive.toFlag()));

        BlockSide opposite = exclusive.opposite();
        if (previouslyMeshed.contains(opposite)) sides = sides.with(opposite);

        return sides;
    }

    /**
     * Sides that re-meshing could improve right now. Empty if nothing new is
     * available, or if some viable neighbor is currently not readable, as a retry
     * would likely fail again.
     */
    public static Sides determineImprovementSides(Chunk chunk, Sides usedSides) {
        NeighborAvailability availability = checkNeighbors(chunk, true);

        if (!availability.complete()) return Sides.NONE;

        Sides acquirable = availability.acquirable();
        return usedSides.containsAll(acquirable) ? Sides.NONE : acquirable;
    }

    /** Indices of the sections touching the given side of a chunk. The array must not be modified. */
    static int[] getSideSectionIndices(BlockSide side) {
        return side == BlockSide.ALL ? ALL_SECTIONS : SIDE_SECTIONS[side.ordinal()];
    }

    // --- Access ---

    public Chunk getChunk() {
        return chunk;
    }

    public Sides getAvailableSides() {
        return availableSides;
    }

    /** The side this attempt is exclusive to, or {@link BlockSide#ALL}. */
    public BlockSide getExclusiveSide() {
        return exclusiveSide;
    }

    public boolean isExclusive() {
        return exclusiveSide != BlockSide.ALL;
    }

    public MeshingFactory getMeshingFactory() {
        return meshingFactory;
    }

    /** Indices of the sections this attempt meshes. */
    public int[] getSectionIndices() {
        return getSideSectionIndices(exclusiveSide).clone();
    }

    public Neighbor getNeighbor(BlockSide side) {
        return neighbors[side.ordinal()];
    }

    /** Get the neighbor chunk on a side, or null if it is not available in this attempt. */
    public Chunk getNeighborChunk(BlockSide side) {
        return neighbors[side.ordinal()] instanceof Available available ? available.chunk() : null;
    }

    /**
     * Get a section of the center chunk or of an available neighbor.
     * Returns null for sections of chunks this attempt does not have.
     */
    public Section getSection(SectionPos position) {
        checkNotReleased();

        ChunkPos target = position.chunk();
        if (target.equals(chunk.getPos())) return chunk.getSection(position);

        BlockSide side = chunk.getPos().sideTowards(target);
        if (side == null) return null;

        Chunk neighbor = getNeighborChunk(side);
        return neighbor != null ? neighbor.getSection(position) : null;
    }

    /** Block tint at a world block position. */
    public int getBlockTint(int x, int y, int z) {
        return chunk.getWorld().getBlockTint(x, y, z);
    }

    /** Fluid tint at a world block position. */
    public int getFluidTint(int x, int y, int z) {
        return chunk.getWorld().getFluidTint(x, y, z);
    }

    // --- Result ---

    /**
     * Package the section meshes of this attempt.
     *
     * @param sections         section meshes by section index
     * @param previouslyMeshed the sides the previous mesh of the chunk reflected
     */
    public ChunkMeshData createMeshData(SectionMeshData[] sections, Sides previouslyMeshed) {
        Sides sides = computeMeshedSides(availableSides, previouslyMeshed, exclusiveSide);
        return new ChunkMeshData(chunk.getPos(), sections, sides, getSideSectionIndices(exclusiveSide));
    }

    // --- Release ---

    public boolean isReleased() {
        return released;
    }

    /** Release every held guard. Further calls do nothing. */
    public void release() {
        if (released) return;
        released = true;

        for (int i = 0; i < neighbors.length; i++) {
            if (neighbors[i] instanceof Available available && available.guard() != null) {
                available.guard().release();
            }
            neighbors[i] = Unavailable.INSTANCE;
        }
    }

    @Override
    public void close() {
        release();
    }

    private void checkNotReleased() {
        if (released) throw new IllegalStateException("Meshing context of " + chunk + " used after release");
    }

    @Override
    public String toString() {
        String text = "[" + availableSides.toCompactString() + "]";
        if (isExclusive()) text += "+(" + exclusiveSide.toCompactChar() + ")";
        return text;
    }
}
