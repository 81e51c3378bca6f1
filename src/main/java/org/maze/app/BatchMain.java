package org.maze.app;

import org.maze.core.generation.ConsoleStageListener;
import org.maze.core.generation.GenerationPipeline;
import org.maze.core.generation.StageProfile;
import org.maze.core.io.LocalMazeConfigLoader;
import org.maze.core.io.MazeReportSerializer;
import org.maze.core.model.config.MazeSettings;
import org.maze.core.service.Level;
import org.maze.core.service.LevelGenerationService;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates one level per seed in [from, to] and prints stats.
 *
 * Usage: BatchMain [from] [to] [--rows N] [--columns N] [--algorithm NAME] [--json FILE] [--no-validate]
 */
public class BatchMain {

    public static void main(String[] args) {
        long from = 1;
        long to = 10;
        List<String> positional = collectPositionalArgs(args);
        if (positional.size() >= 1) from = Long.parseLong(positional.get(0));
        if (positional.size() >= 2) to = Long.parseLong(positional.get(1));

        MazeSettings template = buildSettings(args);
        boolean validate = !hasFlag(args, "--no-validate");
        String jsonOut = findOptionValue(args, "--json");

        LevelGenerationService service = new LevelGenerationService(
                new GenerationPipeline(StageProfile.full(), validate, new ConsoleStageListener()));

        long batchStartMs = System.currentTimeMillis();
        int ok = 0;
        int fail = 0;
        List<Level> levels = new ArrayList<>();
        System.out.println("[BATCH_START] from=" + from + " to=" + to
                + " grid=" + template.rows + "x" + template.columns
                + " algorithm=" + (template.algorithm == null ? "random" : template.algorithm));

        for (long seed = from; seed <= to; seed++) {
            try {
                Level level = service.generate(template.withSeed(seed));
                levels.add(level);
                ok++;
                System.out.println("[LEVEL_OK] seed=" + seed
                        + " alg=" + level.algorithm
                        + " start=" + level.start
                        + " goal=" + level.goal
                        + " path=" + level.pathLength()
                        + " deadEnds=" + level.deadEnds.size());
            } catch (Exception ex) {
                fail++;
                System.err.println("[BATCH] FAIL seed=" + seed + " : " + ex.getMessage());
            }
        }

        if (jsonOut != null) {
            Path out = Paths.get(jsonOut);
            try {
                Files.writeString(out, MazeReportSerializer.toJson(levels), StandardCharsets.UTF_8);
                System.out.println("[BATCH] report written to " + out.toAbsolutePath());
            } catch (Exception ex) {
                throw new RuntimeException("Failed to write report: " + out, ex);
            }
        }

        System.out.println("[BATCH_DONE] ok=" + ok
                + " fail=" + fail
                + " durMs=" + (System.currentTimeMillis() - batchStartMs));
    }

    static MazeSettings buildSettings(String[] args) {
        MazeSettings settings = new MazeSettings(0L);
        LocalMazeConfigLoader.apply(settings);

        String rows = findOptionValue(args, "--rows");
        String columns = findOptionValue(args, "--columns");
        String algorithm = findOptionValue(args, "--algorithm");
        if (rows != null) settings.rows = Integer.parseInt(rows);
        if (columns != null) settings.columns = Integer.parseInt(columns);
        if (algorithm != null) settings.algorithm = algorithm;
        return settings;
    }

    static String findOptionValue(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    static List<String> collectPositionalArgs(String[] args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (isOptionWithValue(token)) {
                i++;
                continue;
            }
            if (token.startsWith("--")) {
                continue;
            }
            out.add(token);
        }
        return out;
    }

    private static boolean isOptionWithValue(String token) {
        return "--rows".equals(token)
                || "--columns".equals(token)
                || "--algorithm".equals(token)
                || "--json".equals(token);
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String a : args) {
            if (flag.equals(a)) return true;
        }
        return false;
    }
}
