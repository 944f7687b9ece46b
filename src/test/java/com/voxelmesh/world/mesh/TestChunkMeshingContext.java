package com.voxelmesh.world.mesh;

import com.voxelmesh.world.Access;
import com.voxelmesh.world.BlockSide;
import com.voxelmesh.world.Chunk;
import com.voxelmesh.world.ChunkPos;
import com.voxelmesh.world.Guard;
import com.voxelmesh.world.SectionPos;
import com.voxelmesh.world.Sides;
import com.voxelmesh.world.World;
import com.voxelmesh.world.WorldConstants;
import com.voxelmesh.world.WorldFixtures;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

public class TestChunkMeshingContext {

    private static void assertNoReaders(Chunk[] chunks) {
        for (Chunk chunk : chunks) {
            Assert.assertEquals(chunk.toString(), 0, chunk.getCoreLock().getReaderCount());
        }
    }

    @Test
    public void fullAcquireTakesEveryNeighborAndReleasesIt() throws Throwable {
        World world = new World();
        Chunk center = WorldFixtures.viableChunk(world, 0, 0, 0);
        Chunk[] neighbors = WorldFixtures.surround(world, center);

        ChunkMeshingContext context = ChunkMeshingContext.acquire(center, Sides.NONE, BlockSide.ALL, MeshingFactory.HEAP);
        Assert.assertEquals(Sides.ALL, context.getAvailableSides());
        Assert.assertFalse(context.isExclusive());
        Assert.assertEquals(WorldConstants.SECTION_COUNT, context.getSectionIndices().length);
        Assert.assertEquals(0, center.getCoreLock().getReaderCount());
        for (BlockSide side : BlockSide.sides()) {
            Assert.assertEquals(1, neighbors[side.ordinal()].getCoreLock().getReaderCount());
            Assert.assertSame(neighbors[side.ordinal()], context.getNeighborChunk(side));
            Assert.assertTrue(context.getNeighbor(side) instanceof ChunkMeshingContext.Available);
        }
        Assert.assertEquals("[FBLRDU]", context.toString());

        context.release();
        assertNoReaders(neighbors);
        Assert.assertTrue(context.isReleased());

        context.release();
        context.close();
        assertNoReaders(neighbors);
    }

    @Test
    public void unreadableAndUnviableNeighborsAreSkipped() throws Throwable {
        World world = new World();
        Chunk center = WorldFixtures.viableChunk(world, 0, 0, 0);
        Chunk[] neighbors = WorldFixtures.surround(world, center);
        neighbors[BlockSide.TOP.ordinal()].setFullyDecorated(false);
        world.removeChunk(neighbors[BlockSide.LEFT.ordinal()].getPos());

        try (Guard writer = neighbors[BlockSide.FRONT.ordinal()].acquireCore(Access.WRITE)) {
            try (ChunkMeshingContext context = ChunkMeshingContext.acquire(
                center, Sides.NONE, BlockSide.ALL, MeshingFactory.HEAP)) {
                Assert.assertEquals(Sides.of(BlockSide.BACK, BlockSide.RIGHT, BlockSide.BOTTOM),
                    context.getAvailableSides());
                Assert.assertNull(context.getNeighborChunk(BlockSide.FRONT));
                Assert.assertTrue(context.getNeighbor(BlockSide.TOP) instanceof ChunkMeshingContext.Unavailable);
            }
            Assert.assertTrue(neighbors[BlockSide.FRONT.ordinal()].getCoreLock().isWriteHeld());
        }
        assertNoReaders(neighbors);
    }

    @Test
    public void exclusiveAttemptSkipsTheOppositeNeighbor() throws Throwable {
        World world = new World();
        Chunk center = WorldFixtures.viableChunk(world, 0, 0, 0);
        Chunk[] neighbors = WorldFixtures.surround(world, center);
        Sides meshed = Sides.of(BlockSide.FRONT, BlockSide.BACK, BlockSide.LEFT, BlockSide.RIGHT);

        try (ChunkMeshingContext context = ChunkMeshingContext.acquire(
            center, meshed, BlockSide.TOP, MeshingFactory.HEAP)) {
            Assert.assertTrue(context.isExclusive());
            Assert.assertEquals(BlockSide.TOP, context.getExclusiveSide());
            Assert.assertFalse(context.getAvailableSides().contains(BlockSide.BOTTOM));
            Assert.assertEquals(0, neighbors[BlockSide.BOTTOM.ordinal()].getCoreLock().getReaderCount());
            Assert.assertNull(context.getNeighborChunk(BlockSide.BOTTOM));
            Assert.assertEquals("[FBLR-U]+(U)", context.toString());

            int[] indices = context.getSectionIndices();
            Assert.assertEquals(WorldConstants.CHUNK_SIZE * WorldConstants.CHUNK_SIZE, indices.length);
            for (int index : indices) {
                Assert.assertTrue(SectionPos.fromIndex(center.getPos(), index).requiredSides().contains(BlockSide.TOP));
            }

            ChunkMeshData data = context.createMeshData(new SectionMeshData[WorldConstants.SECTION_COUNT], meshed);
            Assert.assertEquals(meshed.with(BlockSide.TOP), data.getSides());
            Assert.assertArrayEquals(indices, data.getIndices());
        }
        assertNoReaders(neighbors);
    }

    @Test
    public void requestWithoutImprovementMeshesFully() throws Throwable {
        World world = new World();
        Chunk center = WorldFixtures.viableChunk(world, 0, 0, 0);
        Chunk[] neighbors = WorldFixtures.surround(world, center);
        Sides meshed = Sides.ALL.without(BlockSide.TOP);

        try (ChunkMeshingContext context = ChunkMeshingContext.acquire(
            center, meshed, BlockSide.TOP, MeshingFactory.HEAP)) {
            Assert.assertFalse(context.isExclusive());
            Assert.assertEquals(Sides.ALL, context.getAvailableSides());
        }
        assertNoReaders(neighbors);
    }

    @Test
    public void unreadableNeighborIsNotRetriedDuringAcquire() throws Throwable {
        World world = new World();
        Chunk center = WorldFixtures.viableChunk(world, 0, 0, 0);
        Chunk[] neighbors = WorldFixtures.surround(world, center);
        Chunk back = neighbors[BlockSide.BACK.ordinal()];

        try (Guard writer = back.acquireCore(Access.WRITE);
             ChunkMeshingContext context = ChunkMeshingContext.acquire(
                 center, Sides.of(BlockSide.FRONT), BlockSide.RIGHT, MeshingFactory.HEAP)) {
            Assert.assertEquals(BlockSide.RIGHT, context.getExclusiveSide());
            Assert.assertFalse(context.getAvailableSides().contains(BlockSide.BACK));
            Assert.assertFalse(context.getAvailableSides().contains(BlockSide.LEFT));
            Assert.assertTrue(context.getAvailableSides().contains(BlockSide.RIGHT));
        }
        assertNoReaders(neighbors);
    }

    @Test
    public void chooseExclusiveSide() throws Throwable {
        Sides all = Sides.ALL;
        Sides fblr = Sides.of(BlockSide.FRONT, BlockSide.BACK, BlockSide.LEFT, BlockSide.RIGHT);

        Assert.assertEquals(BlockSide.ALL, ChunkMeshingContext.chooseExclusiveSide(BlockSide.ALL, fblr, all, all));
        Assert.assertEquals(BlockSide.ALL, ChunkMeshingContext.chooseExclusiveSide(BlockSide.TOP, Sides.NONE, all, all));
        Assert.assertEquals(BlockSide.TOP, ChunkMeshingContext.chooseExclusiveSide(BlockSide.TOP, fblr, all, all));

        Sides allButTop = all.without(BlockSide.TOP);
        Assert.assertEquals(BlockSide.ALL, ChunkMeshingContext.chooseExclusiveSide(BlockSide.TOP, allButTop, all, all));
        Assert.assertEquals(BlockSide.TOP, ChunkMeshingContext.chooseExclusiveSide(
            BlockSide.TOP, allButTop, all, all.without(BlockSide.LEFT)));
    }

    @Test
    public void exclusiveAttemptsNeverHoldTheOppositeSide() throws Throwable {
        // Every combination of meshed sides, considered sides and request source.
        for (int meshedMask = 0; meshedMask < 64; meshedMask++) {
            for (int consideredMask = 0; consideredMask < 64; consideredMask++) {
                for (BlockSide source : BlockSide.sides()) {
                    Sides meshed = new Sides(meshedMask);
                    Sides considered = new Sides(consideredMask);
                    BlockSide exclusive = ChunkMeshingContext.chooseExclusiveSide(source, meshed, considered, considered);

                    if (exclusive == BlockSide.ALL) {
                        Assert.assertTrue(meshed.isEmpty() || meshed.with(source).containsAll(considered));
                        continue;
                    }
                    Assert.assertEquals(source, exclusive);

                    Sides recorded = ChunkMeshingContext.computeMeshedSides(
                        considered.without(exclusive.opposite()), meshed, exclusive);
                    Assert.assertEquals(meshed.contains(exclusive.opposite()), recorded.contains(exclusive.opposite()));
                    Assert.assertTrue(meshed.union(considered).containsAll(recorded));
                }
            }
        }
    }

    @Test
    public void computeMeshedSides() throws Throwable {
        Sides available = Sides.of(BlockSide.LEFT, BlockSide.RIGHT);

        Assert.assertEquals(Sides.of(BlockSide.LEFT), ChunkMeshingContext.computeMeshedSides(
            available, Sides.of(BlockSide.TOP, BlockSide.FRONT), BlockSide.LEFT));
        Assert.assertEquals(Sides.of(BlockSide.LEFT, BlockSide.RIGHT), ChunkMeshingContext.computeMeshedSides(
            available, Sides.of(BlockSide.TOP, BlockSide.FRONT, BlockSide.RIGHT), BlockSide.LEFT));

        // The opposite side is kept as it was, available or not.
        Assert.assertEquals(Sides.of(BlockSide.LEFT, BlockSide.RIGHT), ChunkMeshingContext.computeMeshedSides(
            Sides.of(BlockSide.LEFT), Sides.of(BlockSide.RIGHT), BlockSide.LEFT));

        // The exclusive side itself is only recorded when its neighbor was there.
        Assert.assertEquals(Sides.NONE, ChunkMeshingContext.computeMeshedSides(
            Sides.NONE, Sides.of(BlockSide.TOP), BlockSide.LEFT));

        // A full attempt records what it had.
        Assert.assertEquals(available, ChunkMeshingContext.computeMeshedSides(available, Sides.ALL, BlockSide.ALL));
    }

    @Test
    public void improvementSides() throws Throwable {
        World world = new World();
        Chunk center = WorldFixtures.viableChunk(world, 0, 0, 0);
        Chunk[] neighbors = WorldFixtures.surround(world, center);

        Sides first = ChunkMeshingContext.determineImprovementSides(center, Sides.NONE);
        Assert.assertEquals(Sides.ALL, first);
        Assert.assertEquals(first, ChunkMeshingContext.determineImprovementSides(center, Sides.NONE));
        Assert.assertEquals(Sides.NONE, ChunkMeshingContext.determineImprovementSides(center, Sides.ALL));

        Sides partial = Sides.of(BlockSide.FRONT, BlockSide.BACK);
        Sides improved = ChunkMeshingContext.determineImprovementSides(center, partial);
        Assert.assertFalse(partial.containsAll(improved));

        // A neighbor that is being written to makes any retry pointless for now.
        try (Guard writer = neighbors[BlockSide.RIGHT.ordinal()].acquireCore(Access.WRITE)) {
            Assert.assertEquals(Sides.NONE, ChunkMeshingContext.determineImprovementSides(center, Sides.NONE));
        }

        // Probing takes no guards.
        assertNoReaders(neighbors);

        world.removeChunk(neighbors[BlockSide.RIGHT.ordinal()].getPos());
        Assert.assertEquals(Sides.ALL.without(BlockSide.RIGHT),
            ChunkMeshingContext.determineImprovementSides(center, Sides.NONE));
    }

    @Test
    public void checkNeighborsStopsEarlyOnlyWhenAsked() throws Throwable {
        World world = new World();
        Chunk center = WorldFixtures.viableChunk(world, 0, 0, 0);
        Chunk[] neighbors = WorldFixtures.surround(world, center);

        try (Guard writer = neighbors[BlockSide.BACK.ordinal()].acquireCore(Access.WRITE)) {
            ChunkMeshingContext.NeighborAvailability full = ChunkMeshingContext.checkNeighbors(center, false);
            Assert.assertEquals(Sides.ALL, full.considered());
            Assert.assertEquals(Sides.ALL.without(BlockSide.BACK), full.acquirable());
            Assert.assertFalse(full.complete());

            ChunkMeshingContext.NeighborAvailability early = ChunkMeshingContext.checkNeighbors(center, true);
            Assert.assertEquals(Sides.of(BlockSide.FRONT, BlockSide.BACK), early.considered());
            Assert.assertEquals(Sides.of(BlockSide.FRONT), early.acquirable());
            Assert.assertFalse(early.complete());
        }
        Assert.assertTrue(ChunkMeshingContext.checkNeighbors(center, true).complete());
    }

    @Test
    public void usingActiveTakesNoGuards() throws Throwable {
        World world = new World();
        Chunk center = world.createChunk(new ChunkPos(0, 0, 0));
        Chunk[] neighbors = WorldFixtures.surround(world, center);
        neighbors[BlockSide.TOP.ordinal()].setActive(false);

        try (ChunkMeshingContext context = ChunkMeshingContext.usingActive(center, MeshingFactory.HEAP)) {
            Assert.assertEquals(Sides.ALL.without(BlockSide.TOP), context.getAvailableSides());
            Assert.assertFalse(context.isExclusive());
            ChunkMeshingContext.Available front = (ChunkMeshingContext.Available) context.getNeighbor(BlockSide.FRONT);
            Assert.assertNull(front.guard());
            assertNoReaders(neighbors);
        }
    }

    @Test
    public void usingActiveOnlyOnTheOwningThread() throws Throwable {
        World world = new World();
        Chunk center = world.createChunk(new ChunkPos(0, 0, 0));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread other = new Thread(() -> {
            try {
                ChunkMeshingContext.usingActive(center, MeshingFactory.HEAP).release();
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        other.start();
        other.join();

        Assert.assertTrue(failure.get() instanceof IllegalStateException);
    }

    @Test
    public void sectionLookups() throws Throwable {
        World world = new World();
        Chunk center = WorldFixtures.viableChunk(world, 0, 0, 0);
        Chunk right = WorldFixtures.viableChunk(world, 1, 0, 0);
        WorldFixtures.viableChunk(world, 1, 1, 0);

        ChunkMeshingContext context = ChunkMeshingContext.acquire(center, Sides.NONE, BlockSide.ALL, MeshingFactory.HEAP);
        Assert.assertSame(center.getSection(5), context.getSection(SectionPos.fromIndex(center.getPos(), 5)));
        Assert.assertSame(right.getSection(0), context.getSection(new SectionPos(4, 0, 0)));
        Assert.assertNull(context.getSection(new SectionPos(-1, 0, 0)));
        // Diagonal chunks are never part of an attempt.
        Assert.assertNull(context.getSection(new SectionPos(4, 4, 0)));

        context.release();
        try {
            context.getSection(new SectionPos(0, 0, 0));
            Assert.fail();
        } catch (IllegalStateException expected) {
            Assert.assertEquals(0, right.getCoreLock().getReaderCount());
        }
    }

    @Test
    public void sideSectionTables() throws Throwable {
        Set<Integer> seen = new HashSet<>();
        for (BlockSide side : BlockSide.sides()) {
            int[] indices = ChunkMeshingContext.getSideSectionIndices(side);
            Assert.assertEquals(16, indices.length);
            for (int index : indices) {
                Assert.assertTrue(SectionPos.fromIndex(new ChunkPos(0, 0, 0), index).requiredSides().contains(side));
                seen.add(index);
            }
        }
        // 64 sections minus the 2x2x2 inner ones.
        Assert.assertEquals(56, seen.size());
        Assert.assertEquals(64, ChunkMeshingContext.getSideSectionIndices(BlockSide.ALL).length);
    }
}
