package com.pinclick.copilot.model;

import java.util.List;

/**
 * Ranked matches plus the ladder stage that produced them.
 */
public record SearchOutcome(List<RankedProject> matches,
                            FallbackStage stage,
                            Double relaxationMultiplier,
                            String relaxationExplanation) {

    public SearchOutcome {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public SearchOutcome(List<RankedProject> matches, FallbackStage stage) {
        this(matches, stage, null, null);
    }

    public static SearchOutcome empty() {
        return new SearchOutcome(List.of(), FallbackStage.NONE);
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }
}
