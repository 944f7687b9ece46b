package com.voxelmesh.world.mesh;

import com.voxelmesh.world.Block;
import com.voxelmesh.world.BlockInstance;
import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.FluidInstance;
import com.voxelmesh.world.Section;
import com.voxelmesh.world.SectionPos;
import com.voxelmesh.world.WorldConstants;
import com.voxelmesh.world.mesh.meshable.BlockMeshInfo;
import com.voxelmesh.world.mesh.meshable.BlockMeshable;
import com.voxelmesh.world.mesh.meshable.ErrorMeshable;
import org.joml.Vector3i;
import org.joml.Vector3ic;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One scan over the blocks of a section, producing its {@link SectionMeshData}.
 *
 * <p>Lookups that leave the section go to the neighbor section on that side,
 * taken from the {@link ChunkMeshingContext}. Where the context has no
 * neighbor, the lookup returns null, meaning "no block", and the face stays visible.
 *
 * <p>A builder is used once, on one thread. The face mergers are reused per thread.
 */
public final class SectionMeshBuilder {

    private static final Logger LOG = Logger.getLogger(SectionMeshBuilder.class.getName());

    private static final int SIZE = WorldConstants.SECTION_SIZE;
    private static final int MASK = SIZE - 1;
    private static final int NO_TINT = -1;

    private static final ThreadLocal<FaceMergerSet> MERGERS = new ThreadLocal<>();

    private final SectionPos position;
    private final ChunkMeshingContext context;
    private final MeshingConfig config;
    private final Section section;
    private final Section[] neighbors = new Section[6];
    private final Vector3ic origin;

    private final int[] blockTints = new int[SIZE * SIZE];
    private final int[] fluidTints = new int[SIZE * SIZE];

    private final Meshing basicOpaque;
    private final Meshing basicTransparent;
    private final Meshing foliage;
    private final Meshing fluid;

    private FaceMergerSet mergers;
    private boolean built;

    public SectionMeshBuilder(SectionPos position, ChunkMeshingContext context, MeshingConfig config) {
        this.position = position;
        this.context = context;
        this.config = config;

        this.section = context.getSection(position);
        if (section == null) {
            throw new IllegalArgumentException("Section " + position + " is not part of " + context.getChunk());
        }

        for (BlockSide side : BlockSide.sides()) {
            neighbors[side.ordinal()] = context.getSection(position.offset(side));
        }

        this.origin = position.firstBlock();
        Arrays.fill(blockTints, NO_TINT);
        Arrays.fill(fluidTints, NO_TINT);

        MeshingFactory factory = context.getMeshingFactory();
        this.basicOpaque = factory.create(config.meshingHint);
        this.basicTransparent = factory.create(config.meshingHint);
        this.foliage = factory.create(config.meshingHint);
        this.fluid = factory.create(config.meshingHint);
    }

    public SectionPos getPosition() {
        return position;
    }

    public MeshingConfig getConfig() {
        return config;
    }

    // --- Lookups ---

    /**
     * Get the block next to a section-local position.
     *
     * @return the block, or null if the position lies in a neighbor section that is not available
     */
    public BlockInstance getBlock(Vector3ic pos, BlockSide side) {
        int x = pos.x() + side.dx();
        int y = pos.y() + side.dy();
        int z = pos.z() + side.dz();

        if (WorldConstants.isInSection(x, y, z)) return section.getBlock(x, y, z);

        Section neighbor = neighbors[side.ordinal()];
        return neighbor != null ? neighbor.getBlock(x & MASK, y & MASK, z & MASK) : null;
    }

    /**
     * Get the fluid next to a section-local position.
     *
     * @return the fluid, {@link FluidInstance#NONE} if there is none, or null if the
     * position lies in a neighbor section that is not available
     */
    public FluidInstance getFluid(Vector3ic pos, BlockSide side) {
        int x = pos.x() + side.dx();
        int y = pos.y() + side.dy();
        int z = pos.z() + side.dz();

        if (WorldConstants.isInSection(x, y, z)) return section.getFluid(x, y, z);

        Section neighbor = neighbors[side.ordinal()];
        return neighbor != null ? neighbor.getFluid(x & MASK, y & MASK, z & MASK) : null;
    }

    /** Block tint of the column at a section-local position. Looked up once per column. */
    public int getBlockTint(Vector3ic pos) {
        int column = (pos.x() << WorldConstants.SECTION_SIZE_EXP) + pos.z();
        int tint = blockTints[column];
        if (tint == NO_TINT) {
            tint = context.getBlockTint(origin.x() + pos.x(), origin.y(), origin.z() + pos.z());
            blockTints[column] = tint;
        }
        return tint;
    }

    /** Fluid tint of the column at a section-local position. Looked up once per column. */
    public int getFluidTint(Vector3ic pos) {
        int column = (pos.x() << WorldConstants.SECTION_SIZE_EXP) + pos.z();
        int tint = fluidTints[column];
        if (tint == NO_TINT) {
            tint = context.getFluidTint(origin.x() + pos.x(), origin.y(), origin.z() + pos.z());
            fluidTints[column] = tint;
        }
        return tint;
    }

    // --- Destinations ---

    public SimpleFaceMerger getSimpleMerger(BlockSide side, boolean opaque) {
        return activeMergers().simple(side, opaque);
    }

    public VaryingHeightFaceMerger getVaryingHeightMerger(BlockSide side, boolean opaque) {
        return activeMergers().varying(side, opaque);
    }

    public VaryingHeightFaceMerger getFluidMerger(BlockSide side) {
        return activeMergers().fluid(side);
    }

    /** Sink for unmerged quads of complex models. */
    public Meshing getBasicMeshing(boolean opaque) {
        return opaque ? basicOpaque : basicTransparent;
    }

    public Meshing getFoliageMeshing() {
        return foliage;
    }

    private FaceMergerSet activeMergers() {
        if (mergers == null) throw new IllegalStateException("Mergers are only available during build()");
        return mergers;
    }

    // --- Scan ---

    /** Scan the section and package the result. Can be called once. */
    public SectionMeshData build() {
        if (built) throw new IllegalStateException("Section " + position + " was already built");
        built = true;

        mergers = obtainMergers(config.fluidInset);
        boolean completed = false;

        try {
            Vector3i pos = new Vector3i();

            for (int x = 0; x < SIZE; x++) {
                for (int y = 0; y < SIZE; y++) {
                    for (int z = 0; z < SIZE; z++) {
                        pos.set(x, y, z);

                        BlockInstance block = section.getBlock(x, y, z);
                        FluidInstance fluidInstance = section.getFluid(x, y, z);

                        meshBlock(pos, block, fluidInstance);

                        if (!fluidInstance.isEmpty()) {
                            fluidInstance.fluid().createMesh(pos, fluidInstance, block, this);
                        }
                    }
                }
            }

            mergers.generate(basicOpaque, basicTransparent, fluid);
            completed = true;
        } finally {
            if (!completed) {
                mergers.clear();
                basicOpaque.dispose();
                basicTransparent.dispose();
                foliage.dispose();
                fluid.dispose();
            }
            mergers = null;
        }

        return new SectionMeshData(basicOpaque, basicTransparent, foliage, fluid);
    }

    private void meshBlock(Vector3i pos, BlockInstance instance, FluidInstance fluidInstance) {
        Block block = instance.block();
        if (block.meshable() == BlockMeshable.NONE) return;

        BlockMeshInfo info = new BlockMeshInfo(block, instance.data(), fluidInstance);

        if (!block.isValidData(instance.data())) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("[Meshing] Invalid data " + instance.data() + " for " + block + " at "
                    + position + " " + pos.x() + "," + pos.y() + "," + pos.z() + ", using error mesh");
            }
            ErrorMeshable.INSTANCE.createMesh(pos, info, this);
            return;
        }

        block.meshable().createMesh(pos, info, this);
    }

    private static FaceMergerSet obtainMergers(float fluidInset) {
        FaceMergerSet set = MERGERS.get();
        if (set == null || set.getFluidInset() != fluidInset) {
            set = new FaceMergerSet(fluidInset);
            MERGERS.set(set);
        }
        return set;
    }
}
