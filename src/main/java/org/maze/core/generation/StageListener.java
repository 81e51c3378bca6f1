package org.maze.core.generation;

public interface StageListener {
    void onStageStart(StageId id, String name);
    void onStageEnd(StageId id, String name, long elapsedMs);
    void onStageSkip(StageId id, String name);
    void onFinished(MazeStats stats);
}
