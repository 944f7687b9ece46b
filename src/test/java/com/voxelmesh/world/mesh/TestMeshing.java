package com.voxelmesh.world.mesh;

import org.joml.Vector3f;
import org.joml.Vector3fc;
import org.junit.Assert;
import org.junit.Test;

import java.nio.FloatBuffer;
import java.nio.IntBuffer;

public class TestMeshing {

    private static final Vector3fc A = new Vector3f(0, 0, 0);
    private static final Vector3fc B = new Vector3f(0, 1, 0);
    private static final Vector3fc C = new Vector3f(1, 1, 0);
    private static final Vector3fc D = new Vector3f(1, 0, 0);

    @Test
    public void heapMeshingGrowsPastItsHint() throws Throwable {
        HeapMeshing meshing = new HeapMeshing(1);
        Vector3f offset = new Vector3f();
        for (int i = 0; i < 100; i++) {
            offset.set(i, 0, 0);
            meshing.pushQuadWithOffset(A, B, C, D, offset, i, -i);
        }

        Assert.assertEquals(100, meshing.count());
        Assert.assertEquals(100 * AbstractMeshing.FLOATS_PER_QUAD, meshing.getPositions().length);
        Assert.assertEquals(100 * AbstractMeshing.INTS_PER_QUAD, meshing.getAttributes().length);
        Assert.assertEquals(new Vector3f(43, 1, 0), meshing.getVertex(42, 2, new Vector3f()));
        Assert.assertEquals(42, meshing.getData(42));
        Assert.assertEquals(-42, meshing.getUV(42));

        // The offset does not leak into the pushed vectors.
        Assert.assertEquals(new Vector3f(1, 1, 0), C);
    }

    @Test
    public void directMeshingWritesPackedBuffers() throws Throwable {
        DirectMeshing meshing = new DirectMeshing(1);
        meshing.grow(2);
        meshing.pushQuad(A, B, C, D, 7, 9);
        meshing.pushQuad(D, C, B, A, 8, 10);
        meshing.pushQuad(A, B, C, D, 11, 12);

        FloatBuffer positions = meshing.getPositions();
        IntBuffer attributes = meshing.getAttributes();
        Assert.assertEquals(3 * AbstractMeshing.FLOATS_PER_QUAD, positions.remaining());
        Assert.assertEquals(3 * AbstractMeshing.INTS_PER_QUAD, attributes.remaining());
        Assert.assertEquals(1.0f, positions.get(AbstractMeshing.FLOATS_PER_QUAD), 0.0f);
        Assert.assertEquals(7, attributes.get(0));
        Assert.assertEquals(10, attributes.get(3));
        Assert.assertEquals(11, attributes.get(4));

        meshing.dispose();
        Assert.assertTrue(meshing.isDisposed());
    }

    @Test
    public void meshingIsDisposedOnce() throws Throwable {
        for (MeshingFactory factory : new MeshingFactory[]{MeshingFactory.HEAP, MeshingFactory.DIRECT}) {
            Meshing meshing = factory.create(4);
            Assert.assertTrue(meshing.isEmpty());
            meshing.dispose();

            try {
                meshing.dispose();
                Assert.fail();
            } catch (IllegalStateException expected) {
                // Disposed twice.
            }
            try {
                meshing.pushQuad(A, B, C, D, 0, 0);
                Assert.fail();
            } catch (IllegalStateException expected) {
                // Used after dispose.
            }
        }
    }

    @Test
    public void configChoosesTheStorage() throws Throwable {
        Meshing heap = MeshingConfig.heapConfig().createFactory().create(1);
        Meshing direct = MeshingConfig.defaultConfig().createFactory().create(1);
        Assert.assertTrue(heap instanceof HeapMeshing);
        Assert.assertTrue(direct instanceof DirectMeshing);
        heap.dispose();
        direct.dispose();

        Assert.assertEquals(0, MeshingConfig.heapConfig().workerThreads);
        Assert.assertTrue(MeshingConfig.defaultConfig().workerThreads > 0);
    }
}
