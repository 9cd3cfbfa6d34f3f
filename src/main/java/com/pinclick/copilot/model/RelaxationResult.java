package com.pinclick.copilot.model;

import java.util.List;

/**
 * Outcome of staged budget widening. A null multiplier means no step found inventory.
 */
public record RelaxationResult(List<RankedProject> projects, Double multiplier, Long relaxedBudget) {

    public RelaxationResult {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }

    public static RelaxationResult noInventory() {
        return new RelaxationResult(List.of(), null, null);
    }

    public boolean found() {
        return multiplier != null;
    }
}
