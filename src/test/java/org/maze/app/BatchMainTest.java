package org.maze.app;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class BatchMainTest {

    @Test
    void positionalArgsSkipOptionValues() {
        String[] args = {"--rows", "12", "5", "--no-validate", "9", "--algorithm", "BinaryTree"};

        assertEquals(List.of("5", "9"), BatchMain.collectPositionalArgs(args));
    }

    @Test
    void findsOptionValues() {
        String[] args = {"1", "2", "--columns", "20", "--json"};

        assertEquals("20", BatchMain.findOptionValue(args, "--columns"));
        assertNull(BatchMain.findOptionValue(args, "--json"));
        assertNull(BatchMain.findOptionValue(args, "--rows"));
    }
}
