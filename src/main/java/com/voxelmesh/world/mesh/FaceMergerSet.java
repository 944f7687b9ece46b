package com.voxelmesh.world.mesh;

import com.voxelmesh.world.BlockSide;

/**
 * The mergers of one section scan: simple and varying height mergers for opaque
 * and transparent blocks, and the fluid mergers. One set is reused per thread.
 */
final class FaceMergerSet {

    private final SimpleFaceMerger[] opaqueSimple = new SimpleFaceMerger[6];
    private final SimpleFaceMerger[] transparentSimple = new SimpleFaceMerger[6];
    private final VaryingHeightFaceMerger[] opaqueVarying = new VaryingHeightFaceMerger[6];
    private final VaryingHeightFaceMerger[] transparentVarying = new VaryingHeightFaceMerger[6];
    private final VaryingHeightFaceMerger[] fluid = new VaryingHeightFaceMerger[6];

    private final float fluidInset;

    FaceMergerSet(float fluidInset) {
        this.fluidInset = fluidInset;

        for (BlockSide side : BlockSide.sides()) {
            int i = side.ordinal();
            opaqueSimple[i] = new SimpleFaceMerger(side);
            transparentSimple[i] = new SimpleFaceMerger(side);
            opaqueVarying[i] = new VaryingHeightFaceMerger(side);
            transparentVarying[i] = new VaryingHeightFaceMerger(side);
            fluid[i] = new VaryingHeightFaceMerger(side, fluidInset);
        }
    }

    float getFluidInset() {
        return fluidInset;
    }

    SimpleFaceMerger simple(BlockSide side, boolean opaque) {
        return (opaque ? opaqueSimple : transparentSimple)[side.ordinal()];
    }

    VaryingHeightFaceMerger varying(BlockSide side, boolean opaque) {
        return (opaque ? opaqueVarying : transparentVarying)[side.ordinal()];
    }

    VaryingHeightFaceMerger fluid(BlockSide side) {
        return fluid[side.ordinal()];
    }

    /** Emit every merger into the matching sink. */
    void generate(Meshing basicOpaque, Meshing basicTransparent, Meshing fluidMeshing) {
        for (int i = 0; i < 6; i++) {
            opaqueSimple[i].generateMesh(basicOpaque);
            transparentSimple[i].generateMesh(basicTransparent);
            opaqueVarying[i].generateMesh(basicOpaque);
            transparentVarying[i].generateMesh(basicTransparent);
            fluid[i].generateMesh(fluidMeshing);
        }
    }

    /** Drop leftovers of a scan that did not complete. */
    void clear() {
        for (int i = 0; i < 6; i++) {
            opaqueSimple[i].clear();
            transparentSimple[i].clear();
            opaqueVarying[i].clear();
            transparentVarying[i].clear();
            fluid[i].clear();
        }
    }
}
