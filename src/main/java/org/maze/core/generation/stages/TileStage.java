package org.maze.core.generation.stages;

import org.maze.core.generation.GenerationStage;
import org.maze.core.generation.MazeContext;
import org.maze.core.generation.StageId;
import org.maze.core.model.Cell;
import org.maze.core.model.TileType;


/**
 * Writes level markers: walls on isolated cells, player at the start of the longest path,
 * stairs at its far end.
 */
public class TileStage implements GenerationStage {

    @Override
    public String name() {
        return "Tile Markers";
    }

    @Override
    public void apply(MazeContext ctx) {
        for (Cell c : ctx.grid) {
            c.tile = c.hasLinks() ? TileType.EMPTY : TileType.WALL;
        }

        if (ctx.longestPath != null) {
            ctx.longestPath.start().tile = TileType.PLAYER;
            // on a 1x1 grid both ends coincide; stairs win
            ctx.longestPath.goal().tile = TileType.STAIRS;
        }
    }

    @Override
    public StageId id() {
        return StageId.TILES;
    }
}
