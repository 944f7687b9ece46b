package com.voxelmesh.world.mesh;

/**
 * Creates the {@link Meshing} sinks a section scan writes into. Supplied by the renderer.
 */
@FunctionalInterface
public interface MeshingFactory {

    Meshing create(int sizeHint);

    MeshingFactory HEAP = HeapMeshing::new;
    MeshingFactory DIRECT = DirectMeshing::new;

    static MeshingFactory forStorage(MeshingConfig.Storage storage) {
        return switch (storage) {
            case HEAP -> HEAP;
            case DIRECT -> DIRECT;
        };
    }
}
