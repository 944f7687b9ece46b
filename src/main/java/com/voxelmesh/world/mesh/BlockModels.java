package com.voxelmesh.world.mesh;

import org.joml.Vector3f;

import java.util.ArrayList;
import java.util.List;

/** Factory methods for the built-in block models. */
public final class BlockModels {

    private BlockModels() {}

    /** Two diagonal planes, both double sided. */
    public static BlockModel cross(int texture) {
        List<BlockModel.Quad> quads = new ArrayList<>();
        quads.add(quad(0.145f, 0f, 0.855f, 0.145f, 1f, 0.855f, 0.855f, 1f, 0.145f, 0.855f, 0f, 0.145f, texture));
        quads.add(quad(0.145f, 0f, 0.145f, 0.145f, 1f, 0.145f, 0.855f, 1f, 0.855f, 0.855f, 0f, 0.855f, texture));
        return new BlockModel(doubleSided(quads));
    }

    /** Two planes along each horizontal axis, three with the middle piece. All double sided. */
    public static BlockModel crop(int texture, boolean middlePiece) {
        List<BlockModel.Quad> quads = new ArrayList<>();
        float[] offsets = middlePiece ? new float[]{0.25f, 0.5f, 0.75f} : new float[]{0.25f, 0.75f};
        for (float o : offsets) {
            quads.add(quad(o, 0f, 0f, o, 1f, 0f, o, 1f, 1f, o, 0f, 1f, texture));
            quads.add(quad(0f, 0f, o, 0f, 1f, o, 1f, 1f, o, 1f, 0f, o, texture));
        }
        return new BlockModel(doubleSided(quads));
    }

    /** An axis aligned box with outward facing quads, in the side order front, back, left, right, bottom, top. */
    public static BlockModel box(float x0, float y0, float z0, float x1, float y1, float z1, int texture) {
        List<BlockModel.Quad> quads = new ArrayList<>(6);
        quads.add(quad(x1, y0, z1, x1, y1, z1, x0, y1, z1, x0, y0, z1, texture)); // front
        quads.add(quad(x0, y0, z0, x0, y1, z0, x1, y1, z0, x1, y0, z0, texture)); // back
        quads.add(quad(x0, y0, z1, x0, y1, z1, x0, y1, z0, x0, y0, z0, texture)); // left
        quads.add(quad(x1, y0, z0, x1, y1, z0, x1, y1, z1, x1, y0, z1, texture)); // right
        quads.add(quad(x0, y0, z1, x0, y0, z0, x1, y0, z0, x1, y0, z1, texture)); // bottom
        quads.add(quad(x0, y1, z0, x0, y1, z1, x1, y1, z1, x1, y1, z0, texture)); // top
        return new BlockModel(quads);
    }

    /** Follow every quad by its back side. */
    public static List<BlockModel.Quad> doubleSided(List<BlockModel.Quad> quads) {
        List<BlockModel.Quad> result = new ArrayList<>(quads.size() * 2);
        for (BlockModel.Quad q : quads) {
            result.add(q);
            result.add(q.flipped());
        }
        return result;
    }

    private static BlockModel.Quad quad(float ax, float ay, float az, float bx, float by, float bz,
                                        float cx, float cy, float cz, float dx, float dy, float dz, int texture) {
        return new BlockModel.Quad(
            new Vector3f(ax, ay, az), new Vector3f(bx, by, bz),
            new Vector3f(cx, cy, cz), new Vector3f(dx, dy, dz),
            QuadData.texture(texture), 0);
    }
}
