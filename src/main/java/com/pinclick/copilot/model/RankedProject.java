package com.pinclick.copilot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A project plus the score (and, for radius results, the distance) it was ranked with.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RankedProject(
        @JsonProperty("project") ProjectSummary project,
        @JsonProperty("_match_score") double matchScore,
        @JsonProperty("distance_km") Double distanceKm
) {
    public RankedProject(ProjectSummary project, double matchScore) {
        this(project, matchScore, null);
    }

    public String name() {
        return project.name();
    }
}
