package com.voxelmesh.world.mesh;

import com.voxelmesh.world.BlockSide;
import org.joml.Vector3f;
import org.joml.Vector3fc;
import org.joml.Vector3ic;

/**
 * Merges faces of blocks and fluids that do not fill their whole block height.
 * Two faces only merge when their size, skip and direction are equal.
 * Partial front and back faces are never extended and partial left and right
 * faces are never combined, as that would stretch their partial height.
 */
public final class VaryingHeightFaceMerger extends MeshFaceMerger {

    private final Vector3fc inset;

    /**
     * @param insetScale how far faces are moved inwards, against the side direction
     */
    public VaryingHeightFaceMerger(BlockSide side, float insetScale) {
        super(side);
        this.inset = new Vector3f(side.dx(), side.dy(), side.dz()).mul(-insetScale);
    }

    public VaryingHeightFaceMerger(BlockSide side) {
        this(side, 0.0f);
    }

    /** Height of a face of the given size, in blocks. */
    public static float getSize(int size) {
        return (size + 1) / 16.0f;
    }

    /** Part of the block above a face of the given size, in blocks. */
    public static float getGap(int size) {
        return 1.0f - getSize(size);
    }

    /**
     * Add a face at the given section-local block position.
     *
     * @param size    face size in height units, {@link #MAX_HEIGHT} is a full block
     * @param skip    lower part of the face covered by a neighbor, or {@link #NO_HEIGHT}
     * @param upwards true if the face starts at the bottom of the block, false if it hangs from the top
     * @param data    the attribute word, see {@link QuadData}
     * @param full    whether the face covers the complete side
     */
    public void addFace(Vector3ic position, int size, int skip, boolean upwards, int data,
                        boolean singleSided, boolean full) {
        add(position.x(), position.y(), position.z(), size, skip, upwards, data, singleSided, full);
    }

    @Override
    protected boolean permitsExtending(boolean full) {
        return full || (side != BlockSide.FRONT && side != BlockSide.BACK);
    }

    @Override
    protected boolean permitsCombining(boolean full) {
        return full || (side != BlockSide.LEFT && side != BlockSide.RIGHT);
    }

    @Override
    protected int decorate(Face face, int uv) {
        return QuadData.withHeight(uv, face.getSize(), face.getSkip(), !face.isUpwards());
    }

    @Override
    protected void applyHeight(Face face, Vector3f a, Vector3f b, Vector3f c, Vector3f d) {
        float gap = getGap(face.getSize());

        if (side == BlockSide.TOP || side == BlockSide.BOTTOM) {
            float dy = 0;
            if (face.isUpwards() && side == BlockSide.TOP) dy = -gap;
            if (!face.isUpwards() && side == BlockSide.BOTTOM) dy = gap;

            a.add(inset).add(0, dy, 0);
            b.add(inset).add(0, dy, 0);
            c.add(inset).add(0, dy, 0);
            d.add(inset).add(0, dy, 0);
            return;
        }

        float skip = getSize(face.getSkip());
        float bottom = face.isUpwards() ? skip : gap;
        float top = face.isUpwards() ? -gap : -skip;

        a.add(inset).add(0, bottom, 0);
        b.add(inset).add(0, top, 0);
        c.add(inset).add(0, top, 0);
        d.add(inset).add(0, bottom, 0);
    }
}
