package com.voxelmesh.world.mesh;

/**
 * Meshing configuration. Holds the tuneable parameters for
 * scheduling, sink allocation and geometry details.
 */
public class MeshingConfig {

    public enum Storage { HEAP, DIRECT }

    public enum Quality { LOW, MEDIUM, HIGH }

    // --- Scheduling ---
    public int workerThreads = 2;           // background meshing threads

    // --- Sinks ---
    public int meshingHint = 1024;          // initial quad capacity per sink
    public Storage storage = Storage.DIRECT;

    // --- Geometry ---
    public float fluidInset = 0.001f;       // fluid faces are moved inwards by this much
    public Quality foliageQuality = Quality.MEDIUM; // HIGH subdivides foliage quads vertically

    public MeshingFactory createFactory() {
        return MeshingFactory.forStorage(storage);
    }

    /** Default config suitable for a GL renderer. */
    public static MeshingConfig defaultConfig() {
        return new MeshingConfig();
    }

    /** Config with heap sinks and no worker threads, for tools and tests. */
    public static MeshingConfig heapConfig() {
        MeshingConfig config = new MeshingConfig();
        config.storage = Storage.HEAP;
        config.workerThreads = 0;
        return config;
    }
}
