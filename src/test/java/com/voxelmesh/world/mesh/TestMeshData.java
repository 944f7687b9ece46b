package com.voxelmesh.world.mesh;

import com.voxelmesh.world.ChunkPos;
import com.voxelmesh.world.Sides;
import com.voxelmesh.world.WorldConstants;
import org.joml.Vector3f;
import org.junit.Assert;
import org.junit.Test;

public class TestMeshData {

    private static SectionMeshData section() {
        return new SectionMeshData(new HeapMeshing(1), new HeapMeshing(1), new HeapMeshing(1), new HeapMeshing(1));
    }

    @Test
    public void sectionMeshDataCountsAllStreams() throws Throwable {
        SectionMeshData data = section();
        Assert.assertFalse(data.isFilled());

        Vector3f v = new Vector3f();
        data.getFoliage().pushQuad(v, v, v, v, 0, 0);
        data.getFluid().pushQuad(v, v, v, v, 0, 0);
        data.getFluid().pushQuad(v, v, v, v, 0, 0);
        Assert.assertTrue(data.isFilled());
        Assert.assertEquals(3, data.getQuadCount());

        data.dispose();
        Assert.assertTrue(data.isDisposed());
        Assert.assertTrue(data.getBasicOpaque().isDisposed());
        Assert.assertTrue(data.getFluid().isDisposed());
    }

    @Test(expected = IllegalStateException.class)
    public void sectionMeshDataIsDisposedOnce() throws Throwable {
        SectionMeshData data = section();
        data.dispose();
        data.dispose();
    }

    @Test
    public void chunkMeshDataDisposesWhatWasNotTaken() throws Throwable {
        SectionMeshData[] sections = new SectionMeshData[WorldConstants.SECTION_COUNT];
        SectionMeshData taken = section();
        SectionMeshData left = section();
        sections[3] = taken;
        sections[4] = left;

        ChunkMeshData data = new ChunkMeshData(new ChunkPos(0, 0, 0), sections, Sides.ALL, new int[]{3, 4});
        Assert.assertSame(taken, data.takeSection(3));
        Assert.assertNull(data.getSection(3));
        Assert.assertSame(left, data.getSection(4));

        data.dispose();
        Assert.assertTrue(data.isDisposed());
        Assert.assertTrue(left.isDisposed());
        Assert.assertFalse(taken.isDisposed());

        // Disposing again does nothing.
        data.dispose();
    }

    @Test(expected = IllegalStateException.class)
    public void chunkMeshDataIsNotUsedAfterDispose() throws Throwable {
        ChunkMeshData data = new ChunkMeshData(new ChunkPos(0, 0, 0),
            new SectionMeshData[WorldConstants.SECTION_COUNT], Sides.NONE, new int[0]);
        data.dispose();
        data.takeSection(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void chunkMeshDataNeedsEverySection() throws Throwable {
        new ChunkMeshData(new ChunkPos(0, 0, 0), new SectionMeshData[3], Sides.NONE, new int[0]);
    }

    @Test
    public void indicesAreCopied() throws Throwable {
        int[] indices = {1, 2};
        ChunkMeshData data = new ChunkMeshData(new ChunkPos(0, 0, 0),
            new SectionMeshData[WorldConstants.SECTION_COUNT], Sides.NONE, indices);
        indices[0] = 9;
        data.getIndices()[1] = 9;
        Assert.assertArrayEquals(new int[]{1, 2}, data.getIndices());
    }
}
