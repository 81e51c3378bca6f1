package org.maze.core.generation;

public interface GenerationStage {
    StageId id();
    String name();
    void apply(MazeContext ctx);
}
