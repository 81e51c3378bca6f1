package org.maze.core.generation.stages;

import org.maze.core.generation.GenerationStage;
import org.maze.core.generation.MazeContext;
import org.maze.core.generation.StageId;


public class DeadEndsStage implements GenerationStage {

    @Override
    public String name() {
        return "Dead Ends";
    }

    @Override
    public void apply(MazeContext ctx) {
        ctx.deadEnds = ctx.grid.deadEnds();
    }

    @Override
    public StageId id() {
        return StageId.DEAD_ENDS;
    }
}
