package com.voxelmesh.world;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory chunk store. All world mutation happens on the owning thread,
 * which is the thread that created the world (see {@link #setOwningThread(Thread)}).
 * Chunk lookups through {@link #tryGetChunk(ChunkPos)} are safe from any thread.
 */
public class World {

    private final Map<ChunkPos, Chunk> chunks = new ConcurrentHashMap<>();
    private final TintProvider tints;
    private volatile Thread owningThread;

    public World(TintProvider tints) {
        this.tints = tints;
        this.owningThread = Thread.currentThread();
    }

    public World() {
        this(TintProvider.NEUTRAL);
    }

    // --- Threading ---

    public boolean isOnOwningThread() {
        return Thread.currentThread() == owningThread;
    }

    /** Hand ownership to another thread, e.g. when the game loop starts. */
    public void setOwningThread(Thread thread) {
        this.owningThread = thread;
    }

    /** Fail with an IllegalStateException when not called on the owning thread. */
    public void requireOwningThread(String operation) {
        if (!isOnOwningThread()) {
            throw new IllegalStateException("Cannot " + operation + " from thread "
                + Thread.currentThread().getName() + ", owned by " + owningThread.getName());
        }
    }

    // --- Chunks ---

    /** Get a chunk if it exists. Safe from any thread. */
    public Chunk tryGetChunk(ChunkPos pos) {
        return chunks.get(pos);
    }

    /** Get a chunk if it exists and is active. Owning thread only. */
    public Chunk getActiveChunk(ChunkPos pos) {
        requireOwningThread("get active chunk");
        Chunk chunk = chunks.get(pos);
        return chunk != null && chunk.isActive() ? chunk : null;
    }

    public Chunk createChunk(ChunkPos pos) {
        requireOwningThread("create chunk");
        Chunk chunk = new Chunk(this, pos);
        Chunk existing = chunks.putIfAbsent(pos, chunk);
        if (existing != null) {
            throw new IllegalStateException("Chunk " + pos + " already exists");
        }
        return chunk;
    }

    /** Remove and dispose a chunk. Returns false if there was none. */
    public boolean removeChunk(ChunkPos pos) {
        requireOwningThread("remove chunk");
        Chunk chunk = chunks.remove(pos);
        if (chunk == null) return false;
        chunk.dispose();
        return true;
    }

    // --- Tint ---

    public int getBlockTint(int x, int y, int z) {
        return tints.getBlockTint(x, y, z);
    }

    public int getFluidTint(int x, int y, int z) {
        return tints.getFluidTint(x, y, z);
    }
}
