package com.voxelmesh.world.stream;

import com.voxelmesh.world.mesh.ChunkMeshData;
import com.voxelmesh.world.mesh.Mesher;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background worker thread for chunk meshing. Pulls tasks from the queue,
 * builds the section meshes, gives up the task's access and publishes it.
 */
public class MeshingWorker implements Runnable {

    private static final Logger LOG = Logger.getLogger(MeshingWorker.class.getName());

    private final BlockingQueue<MeshTask> taskQueue;
    private final ConcurrentLinkedQueue<MeshTask> completedQueue;
    private final Mesher mesher;
    private volatile boolean running = true;

    public MeshingWorker(BlockingQueue<MeshTask> taskQueue,
                         ConcurrentLinkedQueue<MeshTask> completedQueue,
                         Mesher mesher) {
        this.taskQueue = taskQueue;
        this.completedQueue = completedQueue;
        this.mesher = mesher;
    }

    @Override
    public void run() {
        while (running) {
            try {
                MeshTask task = taskQueue.poll(100, TimeUnit.MILLISECONDS);
                if (task == null) continue;

                process(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * Mesh one task and publish it. Also used by the scheduler when it runs without threads.
     * A mesh finished after {@link #stop()} is disposed instead, as nobody drains the queue anymore.
     */
    void process(MeshTask task) {
        ChunkMeshData data = null;
        try {
            data = mesher.meshChunk(task.getContext(), task.getPreviouslyMeshed());
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "[Meshing] Failed to mesh " + task.getChunk(), e);
        } finally {
            task.releaseAccess();
        }

        if (!running) {
            if (data != null) data.dispose();
            LOG.fine("[Meshing] Discarded mesh of " + task.getChunk() + " finished after stop");
            return;
        }

        task.setResult(data);
        completedQueue.add(task);
    }

    public void stop() {
        running = false;
    }
}
