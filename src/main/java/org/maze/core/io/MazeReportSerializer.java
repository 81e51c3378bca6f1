package org.maze.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.maze.core.model.Cell;
import org.maze.core.service.Level;

import java.util.List;

/**
 * Compact level summary. Link state is not included: a level is reproduced from its seed.
 * Short-key schema:
 * sv  = schemaVersion
 * s   = seed
 * a   = algorithm name
 * r,c = rows, columns
 * l   = link count
 * de  = dead-end count
 * lp  = longest path {s: [row, col], g: [row, col], n: length}
 */
public class MazeReportSerializer {

    static final int SCHEMA_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String toJson(Level level) throws JsonProcessingException {
        return MAPPER.writeValueAsString(toNode(level));
    }

    public static String toJson(List<Level> levels) throws JsonProcessingException {
        ArrayNode arr = MAPPER.createArrayNode();
        for (Level level : levels) {
            arr.add(toNode(level));
        }
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(arr);
    }

    public static ObjectNode toNode(Level level) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("sv", SCHEMA_VERSION);
        root.put("s", level.seed);
        root.put("a", level.algorithm);
        root.put("r", level.grid.rows);
        root.put("c", level.grid.columns);
        root.put("l", level.grid.linkCount());
        root.put("de", level.deadEnds.size());

        ObjectNode lp = root.putObject("lp");
        lp.set("s", coords(level.start));
        lp.set("g", coords(level.goal));
        lp.put("n", level.pathLength());
        return root;
    }

    private static ArrayNode coords(Cell c) {
        ArrayNode a = MAPPER.createArrayNode();
        a.add(c.row);
        a.add(c.column);
        return a;
    }
}
