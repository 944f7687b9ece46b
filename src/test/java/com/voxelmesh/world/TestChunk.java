package com.voxelmesh.world;

import com.voxelmesh.world.mesh.ChunkMeshData;
import com.voxelmesh.world.mesh.HeapMeshing;
import com.voxelmesh.world.mesh.SectionMeshData;
import org.junit.Assert;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicReference;

public class TestChunk {

    private static SectionMeshData emptySection() {
        return new SectionMeshData(new HeapMeshing(0), new HeapMeshing(0), new HeapMeshing(0), new HeapMeshing(0));
    }

    @Test
    public void blocksAndFluidsArePacked() throws Throwable {
        World world = new World();
        Chunk chunk = world.createChunk(new ChunkPos(1, 0, -1));

        chunk.setBlock(17, 33, 63, Blocks.SNOW, 5);
        chunk.setFluid(17, 33, 63, Fluids.WATER, 3, false);
        Assert.assertEquals(new BlockInstance(Blocks.SNOW, 5), chunk.getBlock(17, 33, 63));

        Section section = chunk.getLocalSection(1, 2, 3);
        Assert.assertEquals(new FluidInstance(Fluids.WATER, 3, false), section.getFluid(1, 1, 15));
        Assert.assertSame(section, chunk.getSection(SectionPos.from(chunk.getPos(), 1, 2, 3)));
        Assert.assertFalse(section.isEmpty());
        Assert.assertTrue(chunk.getLocalSection(0, 0, 0).isEmpty());
        Assert.assertEquals(FluidInstance.NONE, chunk.getLocalSection(0, 0, 0).getFluid(4, 4, 4));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void blockOutsideChunk() throws Throwable {
        new World().createChunk(new ChunkPos(0, 0, 0)).setBlock(64, 0, 0, Blocks.STONE, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void sectionOfOtherChunk() throws Throwable {
        new World().createChunk(new ChunkPos(0, 0, 0)).getSection(new SectionPos(4, 0, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void blockDataOutOfRange() throws Throwable {
        Section.encode(Blocks.STONE, Section.MAX_DATA + 1, Fluids.NONE, 1, true);
    }

    @Test
    public void viabilityNeedsDecorationAndActivationRequest() throws Throwable {
        World world = new World();
        Chunk chunk = world.createChunk(new ChunkPos(0, 0, 0));
        Assert.assertFalse(chunk.isViable());
        chunk.setFullyDecorated(true);
        Assert.assertFalse(chunk.isViable());
        chunk.setRequestedToActivate(true);
        Assert.assertTrue(chunk.isViable());
        chunk.dispose();
        Assert.assertFalse(chunk.isViable());
    }

    @Test
    public void applyingMeshDataReplacesAndDisposesOldSections() throws Throwable {
        World world = new World();
        Chunk chunk = world.createChunk(new ChunkPos(0, 0, 0));
        int corner = WorldConstants.localSectionToIndex(0, 0, 0);
        int inner = WorldConstants.localSectionToIndex(1, 1, 1);

        SectionMeshData first = emptySection();
        SectionMeshData[] sections = new SectionMeshData[WorldConstants.SECTION_COUNT];
        sections[corner] = first;
        chunk.setMeshData(new ChunkMeshData(chunk.getPos(), sections, Sides.of(BlockSide.LEFT), new int[]{corner}));

        Assert.assertTrue(chunk.hasMeshData());
        Assert.assertEquals(Sides.of(BlockSide.LEFT), chunk.getMeshedSides());
        Assert.assertSame(first, chunk.getSectionMesh(corner));
        Assert.assertEquals(Sides.of(BlockSide.BOTTOM, BlockSide.BACK), chunk.getMissingSides(corner));

        SectionMeshData second = emptySection();
        SectionMeshData innerMesh = emptySection();
        sections = new SectionMeshData[WorldConstants.SECTION_COUNT];
        sections[corner] = second;
        sections[inner] = innerMesh;
        chunk.setMeshData(new ChunkMeshData(chunk.getPos(), sections, Sides.ALL, new int[]{corner, inner}));

        Assert.assertTrue(first.isDisposed());
        Assert.assertFalse(second.isDisposed());
        Assert.assertSame(second, chunk.getSectionMesh(corner));
        Assert.assertEquals(Sides.NONE, chunk.getMissingSides(corner));
        Assert.assertEquals(Sides.NONE, chunk.getMissingSides(inner));

        chunk.markSectionIncomplete(inner, Sides.of(BlockSide.TOP));
        Assert.assertEquals(Sides.of(BlockSide.TOP), chunk.getMissingSides(inner));

        world.removeChunk(chunk.getPos());
        Assert.assertTrue(second.isDisposed());
        Assert.assertTrue(innerMesh.isDisposed());
    }

    @Test(expected = IllegalStateException.class)
    public void meshDataOfAnotherChunkIsRejected() throws Throwable {
        World world = new World();
        Chunk chunk = world.createChunk(new ChunkPos(0, 0, 0));
        chunk.setMeshData(new ChunkMeshData(new ChunkPos(1, 0, 0),
            new SectionMeshData[WorldConstants.SECTION_COUNT], Sides.NONE, new int[0]));
    }

    @Test
    public void meshBookkeepingStaysOnTheOwningThread() throws Throwable {
        World world = new World();
        Chunk chunk = world.createChunk(new ChunkPos(0, 0, 0));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread other = new Thread(() -> {
            try {
                chunk.markSectionIncomplete(0, Sides.ALL);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        other.start();
        other.join();

        Assert.assertTrue(failure.get() instanceof IllegalStateException);
        Assert.assertEquals(Sides.NONE, chunk.getMissingSides(0));
    }

    @Test
    public void activeChunkLookup() throws Throwable {
        World world = new World();
        Chunk chunk = world.createChunk(new ChunkPos(0, 0, 0));
        Assert.assertSame(chunk, world.tryGetChunk(chunk.getPos()));
        Assert.assertNull(world.getActiveChunk(chunk.getPos()));
        chunk.setActive(true);
        Assert.assertSame(chunk, world.getActiveChunk(chunk.getPos()));
        Assert.assertTrue(world.removeChunk(chunk.getPos()));
        Assert.assertFalse(world.removeChunk(chunk.getPos()));
        Assert.assertNull(world.tryGetChunk(chunk.getPos()));
    }
}
