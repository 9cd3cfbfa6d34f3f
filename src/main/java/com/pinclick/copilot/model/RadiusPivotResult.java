package com.pinclick.copilot.model;

import java.util.List;

/**
 * Candidates within the radius of an anchor, nearest first. {@code anchor} is null when the
 * anchor location could not be resolved, in which case the list is always empty.
 */
public record RadiusPivotResult(String anchorName, Coordinates anchor, double radiusKm, List<RankedProject> projects) {

    public RadiusPivotResult {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }

    public static RadiusPivotResult noAnchor(String anchorName, double radiusKm) {
        return new RadiusPivotResult(anchorName, null, radiusKm, List.of());
    }

    public boolean anchorResolved() {
        return anchor != null;
    }
}
