package org.maze.core.generation;

import org.junit.jupiter.api.Test;
import org.maze.core.model.Cell;
import org.maze.core.model.TileType;
import org.maze.core.model.config.MazeSettings;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationPipelineTest {

    @Test
    void runsStagesInFixedOrder() {
        RecordingStageListener listener = new RecordingStageListener();
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, listener);

        MazeContext ctx = pipeline.run(new MazeSettings(42L, 6, 6, "BinaryTree"));

        assertEquals(List.of(
                "start:GRID", "end:GRID",
                "start:CARVE", "end:CARVE",
                "start:LONGEST_PATH", "end:LONGEST_PATH",
                "start:DEAD_ENDS", "end:DEAD_ENDS",
                "start:TILES", "end:TILES"), listener.events);
        assertSame(ctx.stats, listener.finished);
        assertEquals("BinaryTree", ctx.stats.algorithm);
        assertEquals(36, ctx.stats.cellCount);
        assertEquals(35, ctx.stats.linkCount);
        assertEquals(0, ctx.stats.cycleCount);
        assertEquals(ctx.longestPath.length(), ctx.stats.longestPathLength);
        assertEquals(ctx.deadEnds.size(), ctx.stats.deadEndCount);
    }

    @Test
    void carveOnlyProfileSkipsLayout() {
        RecordingStageListener listener = new RecordingStageListener();
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.carveOnly(), true, listener);

        MazeContext ctx = pipeline.run(new MazeSettings(1L, 5, 5, "AldousBroder"));

        assertTrue(listener.events.contains("skip:LONGEST_PATH"));
        assertTrue(listener.events.contains("skip:DEAD_ENDS"));
        assertTrue(listener.events.contains("skip:TILES"));
        assertNull(ctx.longestPath);
        assertNull(ctx.deadEnds);
        assertEquals(-1, ctx.stats.longestPathLength);
        for (Cell c : ctx.grid) {
            assertEquals(TileType.EMPTY, c.tile);
        }
    }

    @Test
    void sameSeedReproducesLevel() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, new RecordingStageListener());

        // algorithm left to the seeded RNG
        MazeContext a = pipeline.run(new MazeSettings(9001L, 9, 11, null));
        MazeContext b = pipeline.run(new MazeSettings(9001L, 9, 11, null));

        assertEquals(a.algorithm.name(), b.algorithm.name());
        assertEquals(MazeAssertions.signature(a.grid), MazeAssertions.signature(b.grid));
        assertEquals(a.longestPath.start().row, b.longestPath.start().row);
        assertEquals(a.longestPath.start().column, b.longestPath.start().column);
        assertEquals(a.longestPath.goal().row, b.longestPath.goal().row);
        assertEquals(a.longestPath.goal().column, b.longestPath.goal().column);
    }

    @Test
    void everyAlgorithmPassesValidation() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, new RecordingStageListener());

        for (MazeAlgorithm a : Algorithms.AVAILABLE) {
            MazeContext ctx = pipeline.run(new MazeSettings(3L, 8, 8, a.name()));
            assertEquals(a.name(), ctx.algorithm.name());
            assertNotNull(ctx.longestPath);
        }
    }

    @Test
    void stageFailureIsWrappedWithStageId() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, new RecordingStageListener());

        RuntimeException e = assertThrows(RuntimeException.class,
                () -> pipeline.run(new MazeSettings(1L, 4, 4, "Prim")));

        assertTrue(e.getMessage().contains("GRID"));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void stageEndIsReportedEvenOnFailure() {
        RecordingStageListener listener = new RecordingStageListener();
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, listener);

        assertThrows(RuntimeException.class, () -> pipeline.run(new MazeSettings(1L, 0, 4, "BinaryTree")));

        assertEquals(List.of("start:GRID", "end:GRID"), listener.events);
        assertNull(listener.finished);
    }

    @Test
    void tileMarkersPlacePlayerAndStairs() {
        GenerationPipeline pipeline = new GenerationPipeline(StageProfile.full(), true, new RecordingStageListener());

        MazeContext ctx = pipeline.run(new MazeSettings(17L, 7, 7, "RecursiveBacktracker"));

        assertEquals(TileType.PLAYER, ctx.longestPath.start().tile);
        assertEquals(TileType.STAIRS, ctx.longestPath.goal().tile);
        for (Cell c : ctx.grid) {
            if (c == ctx.longestPath.start() || c == ctx.longestPath.goal()) continue;
            assertEquals(TileType.EMPTY, c.tile);
        }
    }

    @Test
    void exposesStagesInOrder() {
        List<GenerationStage> stages = new GenerationPipeline(null, false, new RecordingStageListener()).stages();

        assertEquals(5, stages.size());
        assertEquals(StageId.GRID, stages.get(0).id());
        assertEquals(StageId.TILES, stages.get(4).id());
    }
}
