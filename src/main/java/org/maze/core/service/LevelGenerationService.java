package org.maze.core.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.maze.core.generation.GenerationPipeline;
import org.maze.core.generation.MazeContext;
import org.maze.core.io.MazeReportSerializer;
import org.maze.core.model.config.MazeSettings;

public class LevelGenerationService {

    private final GenerationPipeline pipeline;

    public LevelGenerationService(GenerationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public LevelGenerationService() {
        this(new GenerationPipeline());
    }

    /** A fresh grid per call; the same settings always give the same level. */
    public Level generate(MazeSettings settings) {
        MazeContext ctx = pipeline.run(settings);
        if (ctx.longestPath == null || ctx.deadEnds == null) {
            throw new IllegalStateException("Pipeline profile must include LONGEST_PATH and DEAD_ENDS to build a level");
        }
        return new Level(
                settings.seed,
                ctx.algorithm.name(),
                ctx.grid,
                ctx.longestPath.start(),
                ctx.longestPath.goal(),
                ctx.longestPath.path(),
                ctx.deadEnds,
                ctx.stats
        );
    }

    public String encodeReport(Level level) throws JsonProcessingException {
        return MazeReportSerializer.toJson(level);
    }
}
