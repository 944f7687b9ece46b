package com.voxelmesh.world.mesh;

import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.WorldConstants;
import org.joml.Vector3f;
import org.joml.Vector3i;
import org.joml.Vector3ic;

import java.util.ArrayDeque;

/**
 * Greedy merging of the unit faces of one block side during one section scan.
 *
 * <p>Faces are kept in per layer and per row linked lists. A new face either
 * extends the last face of its row along the row (same key, directly adjacent)
 * or opens a new face. Afterwards it is combined with an equal face of the
 * previous row, growing the face across rows. At the end of the scan every
 * remaining face is emitted as one quad.
 *
 * <p>Faces must be submitted in scan order: x outermost, then y, then z.
 * A merger is single threaded and reused across scans after {@link #generateMesh(Meshing)}
 * or {@link #clear()}.
 */
public abstract class MeshFaceMerger {

    /** The largest face size, covering a full block side. */
    public static final int MAX_HEIGHT = 15;
    /** Face size meaning "nothing", used for skips. */
    public static final int NO_HEIGHT = -1;

    private static final int SIZE = WorldConstants.SECTION_SIZE;

    protected final BlockSide side;

    private final Vector3ic lengthAxis;
    private final Vector3ic heightAxis;
    private final Vector3ic sideOffset;

    private final Face[][] lastFaces = new Face[SIZE][SIZE];
    private final ArrayDeque<Face> pool = new ArrayDeque<>();
    private int count;

    private final Vector3f v00 = new Vector3f();
    private final Vector3f v01 = new Vector3f();
    private final Vector3f v10 = new Vector3f();
    private final Vector3f v11 = new Vector3f();

    protected MeshFaceMerger(BlockSide side) {
        if (side == BlockSide.ALL) throw new IllegalArgumentException("A merger needs a single side");
        this.side = side;
        this.lengthAxis = switch (side) {
            case FRONT, BACK -> new Vector3i(0, 1, 0);
            default -> new Vector3i(0, 0, 1);
        };
        this.heightAxis = switch (side) {
            case LEFT, RIGHT -> new Vector3i(0, -1, 0);
            default -> new Vector3i(-1, 0, 0);
        };
        // Closes the gaps left by the negative height axes.
        this.sideOffset = switch (side) {
            case FRONT -> new Vector3i(1, 0, 1);
            case BACK, BOTTOM -> new Vector3i(1, 0, 0);
            case LEFT -> new Vector3i(0, 1, 0);
            case RIGHT, TOP -> new Vector3i(1, 1, 0);
            case ALL -> throw new IllegalStateException();
        };
    }

    public BlockSide getSide() {
        return side;
    }

    /** Number of faces currently held, after merging. */
    public int getCount() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Add a face.
     *
     * @param size        face size in height units, {@link #MAX_HEIGHT} for a full face
     * @param skip        part of the face that is skipped, in height units, or {@link #NO_HEIGHT}
     * @param upwards     whether the face starts at the bottom of the block
     * @param data        attribute word, part of the merge key
     * @param singleSided false to also emit the back side
     * @param full        whether the face covers a complete block side
     */
    protected final void add(int x, int y, int z, int size, int skip, boolean upwards,
                             int data, boolean singleSided, boolean full) {
        int layer, row, position;
        switch (side) {
            case FRONT, BACK -> { layer = z; row = x; position = y; }
            case LEFT, RIGHT -> { layer = x; row = y; position = z; }
            default -> { layer = y; row = x; position = z; }
        }

        Face current = obtain(size, skip, upwards, data, position, singleSided);
        Face last = lastFaces[layer][row];

        if (permitsExtending(full) && last != null && last.isExtendable(current)) {
            pool.push(current);
            current = last;
            current.length++;
        } else {
            current.previous = last;
            lastFaces[layer][row] = current;
            count++;
        }

        if (row == 0 || !permitsCombining(full)) return;

        Face candidate = lastFaces[layer][row - 1];
        Face before = null;

        while (candidate != null) {
            if (candidate.isCombinable(current)) {
                current.height = candidate.height + 1;

                if (before == null) lastFaces[layer][row - 1] = candidate.previous;
                else before.previous = candidate.previous;
                pool.push(candidate);

                count--;
                break;
            }

            before = candidate;
            candidate = candidate.previous;
        }
    }

    /** Whether a face may grow along its row. */
    protected boolean permitsExtending(boolean full) {
        return true;
    }

    /** Whether a face may grow across rows. */
    protected boolean permitsCombining(boolean full) {
        return true;
    }

    /** Move the vertices of a finished face to account for partial heights. */
    protected abstract void applyHeight(Face face, Vector3f a, Vector3f b, Vector3f c, Vector3f d);

    /** Add face specific information to the repetition word. */
    protected int decorate(Face face, int uv) {
        return uv;
    }

    /** Emit all held faces into the meshing and reset the merger. */
    public final void generateMesh(Meshing meshing) {
        if (count == 0) return;

        meshing.grow(count);

        for (int l = 0; l < SIZE; l++) {
            for (int r = 0; r < SIZE; r++) {
                Face face = lastFaces[l][r];

                while (face != null) {
                    emit(meshing, l, r, face);

                    Face next = face.previous;
                    pool.push(face);
                    face = next;
                }

                lastFaces[l][r] = null;
            }
        }

        count = 0;
    }

    /** Drop all held faces without emitting them. */
    public final void clear() {
        for (int l = 0; l < SIZE; l++) {
            for (int r = 0; r < SIZE; r++) {
                Face face = lastFaces[l][r];
                while (face != null) {
                    Face next = face.previous;
                    pool.push(face);
                    face = next;
                }
                lastFaces[l][r] = null;
            }
        }
        count = 0;
    }

    private void emit(Meshing meshing, int layer, int row, Face face) {
        int data = face.data;
        if (side != BlockSide.LEFT && side != BlockSide.RIGHT) data = QuadData.toggleRotation(data);

        int uv = QuadData.withRepetition(0, QuadData.isRotated(data), face.height, face.length);
        uv = decorate(face, uv);

        switch (side) {
            case FRONT, BACK -> v00.set(row, face.position, layer);
            case LEFT, RIGHT -> v00.set(layer, row, face.position);
            default -> v00.set(row, layer, face.position);
        }
        v00.add(sideOffset.x(), sideOffset.y(), sideOffset.z());

        int length = face.length + 1;
        int height = face.height + 1;

        v01.set(v00).add(heightAxis.x() * height, heightAxis.y() * height, heightAxis.z() * height);
        v10.set(v00).add(lengthAxis.x() * length, lengthAxis.y() * length, lengthAxis.z() * length);
        v11.set(v10).add(heightAxis.x() * height, heightAxis.y() * height, heightAxis.z() * height);

        Vector3f a, b, c, d;
        switch (side) {
            case FRONT, BOTTOM -> { a = v01; b = v11; c = v10; d = v00; }
            case BACK -> { a = v00; b = v10; c = v11; d = v01; }
            case LEFT -> { a = v01; b = v00; c = v10; d = v11; }
            case RIGHT -> { a = v11; b = v10; c = v00; d = v01; }
            default -> { a = v11; b = v01; c = v00; d = v10; }
        }

        applyHeight(face, a, b, c, d);

        meshing.pushQuad(a, b, c, d, data, uv);

        if (!face.singleSided) {
            meshing.pushQuad(d, c, b, a, data, QuadData.mirror(uv));
        }
    }

    private Face obtain(int size, int skip, boolean upwards, int data, int position, boolean singleSided) {
        Face face = pool.isEmpty() ? new Face() : pool.pop();
        face.previous = null;
        face.size = size;
        face.skip = skip;
        face.upwards = upwards;
        face.data = data;
        face.position = position;
        face.length = 0;
        face.height = 0;
        face.singleSided = singleSided;
        return face;
    }

    /** A possibly merged face. Length and height count the blocks added to a single face. */
    protected static final class Face {
        int data;
        int size;
        int skip;
        boolean upwards;
        boolean singleSided;

        int position;
        int length;
        int height;

        Face previous;

        public int getSize() { return size; }
        public int getSkip() { return skip; }
        public boolean isUpwards() { return upwards; }

        boolean isExtendable(Face extension) {
            return position + length + 1 == extension.position
                && height == extension.height
                && hasSameKey(extension);
        }

        boolean isCombinable(Face addition) {
            return position == addition.position
                && length == addition.length
                && hasSameKey(addition);
        }

        private boolean hasSameKey(Face other) {
            return data == other.data
                && size == other.size
                && skip == other.skip
                && upwards == other.upwards
                && singleSided == other.singleSided;
        }
    }
}
