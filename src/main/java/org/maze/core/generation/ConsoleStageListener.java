package org.maze.core.generation;

public class ConsoleStageListener implements StageListener {

    @Override
    public void onStageStart(StageId id, String name) {
        System.out.println("[STAGE START] " + id + " - " + name);
    }

    @Override
    public void onStageEnd(StageId id, String name, long elapsedMs) {
        System.out.println("[STAGE END]   " + id + " - " + name + " (" + elapsedMs + " ms)");
    }

    @Override
    public void onStageSkip(StageId id, String name) {
        System.out.println("[STAGE SKIP]  " + id + " - " + name);
    }

    @Override
    public void onFinished(MazeStats stats) {
        MazeStatsReport.print(stats);
    }
}
