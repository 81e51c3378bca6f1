package org.maze.core.generation;

import org.maze.core.generation.stages.BuildGridStage;
import org.maze.core.generation.stages.CarveStage;
import org.maze.core.generation.stages.DeadEndsStage;
import org.maze.core.generation.stages.LongestPathStage;
import org.maze.core.generation.stages.TileStage;
import org.maze.core.model.config.MazeSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class GenerationPipeline {

    private final List<GenerationStage> stages = new ArrayList<>();
    private final StageProfile profile;
    private final boolean enableValidation;
    private final StageListener listener;

    public GenerationPipeline(StageProfile profile, boolean enableValidation, StageListener listener) {
        this.profile = (profile != null) ? profile : StageProfile.full();
        this.enableValidation = enableValidation;
        this.listener = (listener != null) ? listener : new ConsoleStageListener();

        // fixed order
        stages.add(new BuildGridStage());
        stages.add(new CarveStage());
        stages.add(new LongestPathStage());
        stages.add(new DeadEndsStage());
        stages.add(new TileStage());
    }

    /**
     * All stages, validation on, console output.
     */
    public GenerationPipeline() {
        this(StageProfile.full(), true, new ConsoleStageListener());
    }

    public List<GenerationStage> stages() {
        return Collections.unmodifiableList(stages);
    }

    public MazeContext run(MazeSettings settings) {
        MazeContext ctx = new MazeContext(settings);

        for (GenerationStage stage : stages) {
            if (!profile.isEnabled(stage.id())) {
                listener.onStageSkip(stage.id(), stage.name());
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name());

            try {
                stage.apply(ctx);

                if (enableValidation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (RuntimeException e) {
                throw new RuntimeException("Generation failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), elapsed);
            }
        }

        if (ctx.grid != null) {
            ctx.stats = MazeStats.compute(ctx);
            listener.onFinished(ctx.stats);
        }
        return ctx;
    }

    private void runValidation(StageId id, MazeContext ctx) {
        switch (id) {
            case GRID -> Validation.afterGrid(ctx);
            case CARVE -> Validation.afterCarve(ctx);
            case LONGEST_PATH -> Validation.afterLongestPath(ctx);
            case DEAD_ENDS -> Validation.afterDeadEnds(ctx);
            case TILES -> {
                // markers are opaque, nothing to check
            }
        }
    }
}
