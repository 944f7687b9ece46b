package com.voxelmesh.world.stream;

import com.voxelmesh.world.Chunk;
import com.voxelmesh.world.Guard;
import com.voxelmesh.world.Sides;
import com.voxelmesh.world.mesh.ChunkMeshData;
import com.voxelmesh.world.mesh.ChunkMeshingContext;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One queued meshing attempt. Holds read access to the chunk and its
 * neighbors until {@link #releaseAccess()}, which the worker calls once the
 * meshes are built.
 */
public final class MeshTask {

    private final Chunk chunk;
    private final Guard centerGuard;
    private final ChunkMeshingContext context;
    private final Sides previouslyMeshed;
    private final AtomicBoolean accessReleased = new AtomicBoolean();

    private volatile ChunkMeshData result;

    public MeshTask(Chunk chunk, Guard centerGuard, ChunkMeshingContext context, Sides previouslyMeshed) {
        this.chunk = chunk;
        this.centerGuard = centerGuard;
        this.context = context;
        this.previouslyMeshed = previouslyMeshed;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public ChunkMeshingContext getContext() {
        return context;
    }

    public Sides getPreviouslyMeshed() {
        return previouslyMeshed;
    }

    public ChunkMeshData getResult() {
        return result;
    }

    public void setResult(ChunkMeshData result) {
        this.result = result;
    }

    /** Release the guards on the chunk and its neighbors. Only the first call has an effect. */
    public void releaseAccess() {
        if (!accessReleased.compareAndSet(false, true)) return;
        context.release();
        centerGuard.release();
    }

    public boolean isAccessReleased() {
        return accessReleased.get();
    }

    @Override
    public String toString() {
        return "MeshTask[" + chunk + " " + context + "]";
    }
}
