package com.voxelmesh.world.stream;

import com.voxelmesh.world.Access;
import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.Chunk;
import com.voxelmesh.world.ChunkPos;
import com.voxelmesh.world.Guard;
import com.voxelmesh.world.SectionPos;
import com.voxelmesh.world.Sides;
import com.voxelmesh.world.World;
import com.voxelmesh.world.WorldConstants;
import com.voxelmesh.world.mesh.ChunkMeshData;
import com.voxelmesh.world.mesh.ChunkMeshingContext;
import com.voxelmesh.world.mesh.Mesher;
import com.voxelmesh.world.mesh.MeshingConfig;
import com.voxelmesh.world.mesh.MeshingFactory;
import com.voxelmesh.world.mesh.SectionMeshData;
import com.voxelmesh.world.mesh.SectionMesher;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides when chunks are (re-)meshed and moves the work between the owning
 * thread and the meshing workers.
 *
 * <p>All methods except the workers themselves run on the owning thread of the world.
 * Requests are queued with {@link #beginMeshing} or {@link #processMeshingOption},
 * dispatched by {@link #dispatch()} and applied to their chunks by {@link #applyCompleted()};
 * {@link #tick()} does both. A dispatched attempt holds read access to its chunk
 * until the mesh is built.
 *
 * <p>With zero worker threads, attempts are meshed directly while dispatching.
 */
public class ChunkMeshScheduler {

    private static final Logger LOG = Logger.getLogger(ChunkMeshScheduler.class.getName());

    private final World world;
    private final MeshingConfig config;
    private final Mesher mesher;
    private final MeshingFactory factory;

    private final BlockingQueue<MeshTask> taskQueue = new LinkedBlockingQueue<>();
    private final ConcurrentLinkedQueue<MeshTask> completedQueue = new ConcurrentLinkedQueue<>();
    private final List<MeshingWorker> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private final MeshingWorker inlineWorker;

    /** Requested attempts by chunk; two different request sources coalesce to a full attempt. */
    private final Map<ChunkPos, BlockSide> pending = new LinkedHashMap<>();
    private final Set<ChunkPos> inFlight = new HashSet<>();

    public ChunkMeshScheduler(World world, MeshingConfig config, Mesher mesher, MeshingFactory factory) {
        this.world = world;
        this.config = config;
        this.mesher = mesher;
        this.factory = factory;
        this.inlineWorker = new MeshingWorker(taskQueue, completedQueue, mesher);
    }

    public ChunkMeshScheduler(World world, MeshingConfig config) {
        this(world, config, new SectionMesher(config), config.createFactory());
    }

    // --- Lifecycle ---

    /** Start the configured number of worker threads. */
    public void start() {
        if (!threads.isEmpty()) throw new IllegalStateException("Meshing workers already started");

        for (int i = 0; i < config.workerThreads; i++) {
            MeshingWorker worker = new MeshingWorker(taskQueue, completedQueue, mesher);
            Thread thread = new Thread(worker, "Meshing-Worker-" + i);
            thread.setDaemon(true);
            workers.add(worker);
            threads.add(thread);
            thread.start();
        }

        LOG.info("[Meshing] Started " + threads.size() + " meshing worker(s)");
    }

    /**
     * Stop the workers and drop all outstanding work. Queued attempts give up
     * their access and finished but unapplied meshes are disposed. A worker still
     * meshing when the wait ends disposes its result itself.
     */
    public void stop() {
        for (MeshingWorker worker : workers) worker.stop();
        for (Thread thread : threads) {
            thread.interrupt();
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        MeshTask task;
        while ((task = taskQueue.poll()) != null) task.releaseAccess();
        while ((task = completedQueue.poll()) != null) {
            if (task.getResult() != null) task.getResult().dispose();
        }

        pending.clear();
        inFlight.clear();
        workers.clear();
        threads.clear();

        LOG.info("[Meshing] Stopped meshing workers");
    }

    public boolean isThreaded() {
        return !threads.isEmpty();
    }

    // --- Requests ---

    /**
     * Request an attempt for a chunk.
     *
     * @param requestSource the side of the neighbor that asks, or {@link BlockSide#ALL}
     */
    public void beginMeshing(Chunk chunk, BlockSide requestSource) {
        world.requireOwningThread("request meshing");
        pending.merge(chunk.getPos(), requestSource, (a, b) -> a == b ? a : BlockSide.ALL);
    }

    /**
     * Check whether meshing a chunk would improve it and, if so, queue a full
     * attempt for it and ask the neighbors on the new sides to mesh towards it.
     *
     * @return whether an attempt was queued
     */
    public boolean processMeshingOption(Chunk chunk) {
        world.requireOwningThread("process meshing option");
        if (!chunk.isViable()) return false;

        Sides used = chunk.hasMeshData() ? chunk.getMeshedSides() : Sides.NONE;
        Sides improvement = ChunkMeshingContext.determineImprovementSides(chunk, used);

        // A chunk without any mesh always gets one.
        if (improvement.isEmpty() && chunk.hasMeshData()) return false;

        for (BlockSide side : improvement.minus(used).toList()) {
            Chunk neighbor = world.tryGetChunk(chunk.getPos().offset(side));
            if (neighbor == null || !neighbor.hasMeshData()) continue;
            if (neighbor.getMeshedSides().contains(side.opposite())) continue;

            beginMeshing(neighbor, side.opposite());
        }

        beginMeshing(chunk, BlockSide.ALL);
        return true;
    }

    public int getPendingCount() {
        return pending.size();
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public boolean isIdle() {
        return pending.isEmpty() && inFlight.isEmpty();
    }

    // --- Dispatch ---

    /**
     * Dispatch pending requests, then apply finished meshes.
     *
     * @return the number of meshes applied
     */
    public int tick() {
        dispatch();
        return applyCompleted();
    }

    /**
     * Hand pending requests to the workers, or mesh them directly without workers.
     * Requests for chunks that are busy or currently being written stay pending.
     *
     * @return the number of attempts dispatched
     */
    public int dispatch() {
        world.requireOwningThread("dispatch meshing");

        int dispatched = 0;
        Iterator<Map.Entry<ChunkPos, BlockSide>> iterator = pending.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<ChunkPos, BlockSide> entry = iterator.next();
            ChunkPos pos = entry.getKey();

            if (inFlight.contains(pos)) continue;

            Chunk chunk = world.tryGetChunk(pos);
            if (chunk == null || !chunk.isViable()) {
                iterator.remove();
                continue;
            }

            MeshTask task = createTask(chunk, entry.getValue());
            if (task == null) continue;

            iterator.remove();
            inFlight.add(pos);

            dispatched++;

            if (isThreaded()) taskQueue.add(task);
            else inlineWorker.process(task);
        }

        return dispatched;
    }

    private MeshTask createTask(Chunk chunk, BlockSide requestSource) {
        Guard centerGuard = chunk.acquireCore(Access.READ);
        if (centerGuard == null) return null;

        Sides meshed = chunk.hasMeshData() ? chunk.getMeshedSides() : Sides.NONE;
        BlockSide source = chunk.hasMeshData() ? requestSource : BlockSide.ALL;

        ChunkMeshingContext context = ChunkMeshingContext.acquire(chunk, meshed, source, factory);
        return new MeshTask(chunk, centerGuard, context, meshed);
    }

    /**
     * Apply finished meshes to their chunks. Meshes of chunks that were removed
     * in the meantime are disposed.
     *
     * @return the number of meshes applied
     */
    public int applyCompleted() {
        world.requireOwningThread("apply meshes");

        int applied = 0;
        MeshTask task;

        while ((task = completedQueue.poll()) != null) {
            Chunk chunk = task.getChunk();
            inFlight.remove(chunk.getPos());

            // Failed attempts have no result; a later meshing option requests the chunk again.
            ChunkMeshData data = task.getResult();
            if (data == null) continue;

            if (chunk.isDisposed() || world.tryGetChunk(chunk.getPos()) != chunk) {
                LOG.fine("[Meshing] Discarded mesh of removed " + chunk);
                data.dispose();
                continue;
            }

            chunk.setMeshData(data);
            applied++;

            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("[Meshing] Applied " + data);
            }
        }

        return applied;
    }

    // --- Owning thread meshing ---

    /** Mesh a chunk right away, using the active neighbors. */
    public Sides meshOnOwningThread(Chunk chunk) {
        try (ChunkMeshingContext context = ChunkMeshingContext.usingActive(chunk, factory)) {
            Sides meshed = chunk.hasMeshData() ? chunk.getMeshedSides() : Sides.NONE;
            ChunkMeshData data = mesher.meshChunk(context, meshed);
            chunk.setMeshData(data);
            return data.getSides();
        }
    }

    /**
     * Mark a chunk active and complete the sections of its active neighbors
     * that were meshed without it.
     */
    public void onChunkActivated(Chunk chunk) {
        world.requireOwningThread("activate chunk");
        chunk.setActive(true);

        for (BlockSide side : BlockSide.sides()) {
            Chunk neighbor = world.getActiveChunk(chunk.getPos().offset(side));
            if (neighbor != null && neighbor.hasMeshData()) recreateIncompleteMeshes(neighbor);
        }
    }

    /**
     * Re-mesh the sections of a chunk that were meshed while a side they touch
     * was missing, as soon as all of those sides are active.
     *
     * @return the number of sections re-meshed
     */
    public int recreateIncompleteMeshes(Chunk chunk) {
        world.requireOwningThread("recreate incomplete meshes");
        if (!chunk.hasMeshData() || chunk.isDisposed()) return 0;

        ChunkMeshingContext context = null;
        int recreated = 0;

        try {
            for (int index = 0; index < WorldConstants.SECTION_COUNT; index++) {
                Sides missing = chunk.getMissingSides(index);
                if (missing.isEmpty()) continue;

                if (context == null) context = ChunkMeshingContext.usingActive(chunk, factory);
                if (!context.getAvailableSides().containsAll(missing)) continue;

                SectionPos position = SectionPos.fromIndex(chunk.getPos(), index);
                SectionMeshData section = mesher.meshSection(context, position);
                Sides stillMissing = position.requiredSides().minus(context.getAvailableSides());

                chunk.setSectionMesh(index, section, stillMissing);
                recreated++;
            }
        } finally {
            if (context != null) context.release();
        }

        if (recreated > 0) LOG.fine("[Meshing] Recreated " + recreated + " incomplete section(s) of " + chunk);

        return recreated;
    }
}
