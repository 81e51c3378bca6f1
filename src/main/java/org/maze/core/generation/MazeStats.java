package org.maze.core.generation;

import org.maze.core.model.Grid;

public class MazeStats {

    public long seed;
    public String algorithm;

    public int rows;
    public int columns;
    public int cellCount;

    public int linkCount;
    /** links beyond a spanning tree; 0 for a perfect maze */
    public int cycleCount;
    /** cells with no link at all */
    public int isolatedCount;

    public int deadEndCount;
    public int longestPathLength;

    public static MazeStats compute(MazeContext ctx) {
        Grid grid = ctx.grid;
        MazeStats s = new MazeStats();
        s.seed = ctx.settings.seed;
        s.algorithm = (ctx.algorithm != null) ? ctx.algorithm.name() : "-";
        s.rows = grid.rows;
        s.columns = grid.columns;
        s.cellCount = grid.size();
        s.linkCount = grid.linkCount();
        s.cycleCount = Math.max(0, s.linkCount - (s.cellCount - 1));

        for (var c : grid) {
            if (!c.hasLinks()) s.isolatedCount++;
        }

        s.deadEndCount = (ctx.deadEnds != null) ? ctx.deadEnds.size() : grid.deadEnds().size();
        s.longestPathLength = (ctx.longestPath != null) ? ctx.longestPath.length() : -1;
        return s;
    }
}
