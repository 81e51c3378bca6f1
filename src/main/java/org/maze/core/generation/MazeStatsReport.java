package org.maze.core.generation;

import java.util.Locale;

public class MazeStatsReport {

    public static void print(MazeStats s) {
        System.out.println();
        System.out.println("========= MAZE STATS =========");
        System.out.println("Seed: " + s.seed + "  Algorithm: " + s.algorithm);
        System.out.println("Grid: " + s.rows + "x" + s.columns + " cells=" + s.cellCount);
        System.out.println("Links: " + s.linkCount + " cycles=" + s.cycleCount + " isolated=" + s.isolatedCount);
        System.out.println("Dead ends: " + s.deadEndCount + " (" + pct(s.deadEndCount, s.cellCount) + ")");
        if (s.longestPathLength >= 0) {
            System.out.println("Longest path: " + s.longestPathLength + " steps");
        }
        System.out.println("==============================");
        System.out.println();
    }

    static String pct(int part, int total) {
        if (total <= 0) return "n/a";
        return String.format(Locale.ROOT, "%.1f%%", part * 100.0 / total);
    }
}
