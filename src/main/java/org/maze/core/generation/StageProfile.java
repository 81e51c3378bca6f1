package org.maze.core.generation;

import java.util.EnumSet;
import java.util.Set;

public class StageProfile {
    private final Set<StageId> enabled;

    private StageProfile(Set<StageId> enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled(StageId id) {
        return enabled.contains(id);
    }

    public static StageProfile full() {
        return new StageProfile(EnumSet.allOf(StageId.class));
    }

    // grid and maze only, no level layout
    public static StageProfile carveOnly() {
        return new StageProfile(EnumSet.of(StageId.GRID, StageId.CARVE));
    }
}
