package com.voxelmesh.world.mesh;

import org.joml.Vector3f;
import org.joml.Vector3fc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * An immutable list of free-form quads in block space (0 to 1 on each axis),
 * used for shapes that are not merged: plants and complex models.
 */
public record BlockModel(List<BlockModel.Quad> quads) {

    /** One quad with its attribute and repetition words. */
    public record Quad(Vector3fc a, Vector3fc b, Vector3fc c, Vector3fc d, int data, int uv) {

        public Quad withData(int newData) {
            return new Quad(a, b, c, d, newData, uv);
        }

        /** The same quad seen from behind. */
        public Quad flipped() {
            return new Quad(d, c, b, a, data, QuadData.mirror(uv));
        }
    }

    public BlockModel {
        quads = Collections.unmodifiableList(new ArrayList<>(quads));
    }

    public int size() {
        return quads.size();
    }

    public BlockModel withOffset(Vector3fc offset) {
        List<Quad> moved = new ArrayList<>(quads.size());
        for (Quad q : quads) {
            moved.add(new Quad(
                q.a().add(offset, new Vector3f()),
                q.b().add(offset, new Vector3f()),
                q.c().add(offset, new Vector3f()),
                q.d().add(offset, new Vector3f()),
                q.data(), q.uv()));
        }
        return new BlockModel(moved);
    }

    /**
     * Split every quad in two along its a-b edge, which is vertical for plant quads.
     * Gives smoother lighting and animation at the cost of twice the quads.
     */
    public BlockModel subdivideV() {
        List<Quad> split = new ArrayList<>(quads.size() * 2);
        for (Quad q : quads) {
            Vector3f ab = q.a().lerp(q.b(), 0.5f, new Vector3f());
            Vector3f dc = q.d().lerp(q.c(), 0.5f, new Vector3f());
            split.add(new Quad(q.a(), ab, dc, q.d(), q.data(), q.uv()));
            split.add(new Quad(ab, q.b(), q.c(), dc, q.data(), q.uv()));
        }
        return new BlockModel(split);
    }

    /** Push all quads, moved to the given section-local position, with their attribute words mapped. */
    public void push(Meshing meshing, Vector3fc position, IntUnaryOperator data) {
        meshing.grow(quads.size());
        for (Quad q : quads) {
            meshing.pushQuadWithOffset(q.a(), q.b(), q.c(), q.d(), position, data.applyAsInt(q.data()), q.uv());
        }
    }
}
