package com.voxelmesh.world;

import com.voxelmesh.world.mesh.HeapMeshing;
import com.voxelmesh.world.mesh.Meshing;
import org.joml.Vector3f;

/** Shared setup for world and meshing tests. */
public final class WorldFixtures {

    private WorldFixtures() {}

    /** Create a chunk that is decorated, wanted and active. */
    public static Chunk viableChunk(World world, int x, int y, int z) {
        Chunk chunk = world.createChunk(new ChunkPos(x, y, z));
        chunk.setFullyDecorated(true);
        chunk.setRequestedToActivate(true);
        chunk.setActive(true);
        return chunk;
    }

    /** Create viable chunks on all six sides of the given chunk, indexed by side ordinal. */
    public static Chunk[] surround(World world, Chunk center) {
        Chunk[] neighbors = new Chunk[6];
        for (BlockSide side : BlockSide.sides()) {
            ChunkPos pos = center.getPos().offset(side);
            neighbors[side.ordinal()] = viableChunk(world, pos.x(), pos.y(), pos.z());
        }
        return neighbors;
    }

    /** Area of one quad of a heap meshing. */
    public static float area(Meshing meshing, int quad) {
        HeapMeshing heap = (HeapMeshing) meshing;
        Vector3f a = heap.getVertex(quad, 0, new Vector3f());
        Vector3f b = heap.getVertex(quad, 1, new Vector3f());
        Vector3f d = heap.getVertex(quad, 3, new Vector3f());
        return b.sub(a).cross(d.sub(a)).length();
    }

    /** Sum of all quad areas of a heap meshing. */
    public static float totalArea(Meshing meshing) {
        float total = 0;
        for (int i = 0; i < meshing.count(); i++) total += area(meshing, i);
        return total;
    }

    /** Smallest and largest coordinates over all vertices of one quad, as {min, max}. */
    public static Vector3f[] bounds(Meshing meshing, int quad) {
        HeapMeshing heap = (HeapMeshing) meshing;
        Vector3f min = new Vector3f(Float.MAX_VALUE);
        Vector3f max = new Vector3f(-Float.MAX_VALUE);
        Vector3f v = new Vector3f();
        for (int i = 0; i < 4; i++) {
            heap.getVertex(quad, i, v);
            min.min(v);
            max.max(v);
        }
        return new Vector3f[]{min, max};
    }
}
