package com.pinclick.copilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Buyer requirements accumulated over a conversation. Fields are sticky: a merge only
 * overwrites what the update actually carries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Requirements {

    @JsonProperty("configuration")
    private String configuration;

    @JsonProperty("location")
    private String location;

    @JsonProperty("budget_max")
    private Long budgetMax;

    @JsonProperty("project_name")
    private String projectName;

    @JsonProperty("feature_requested")
    private String featureRequested;

    public static Requirements merge(Requirements base, Requirements update) {
        Requirements merged = base == null ? new Requirements() : base.copy();
        if (update == null) {
            return merged;
        }
        if (StringUtils.hasText(update.getConfiguration())) {
            merged.setConfiguration(update.getConfiguration().trim());
        }
        if (StringUtils.hasText(update.getLocation())) {
            merged.setLocation(update.getLocation().trim());
        }
        if (update.getBudgetMax() != null) {
            merged.setBudgetMax(update.getBudgetMax());
        }
        if (StringUtils.hasText(update.getProjectName())) {
            merged.setProjectName(update.getProjectName().trim());
        }
        if (StringUtils.hasText(update.getFeatureRequested())) {
            merged.setFeatureRequested(update.getFeatureRequested().trim());
        }
        return merged;
    }

    public Requirements copy() {
        return new Requirements(configuration, location, budgetMax, projectName, featureRequested);
    }

    /**
     * Search slots still missing, in the order a sales agent would ask for them.
     */
    @JsonIgnore
    public List<String> missingSearchSlots() {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(configuration)) {
            missing.add("configuration");
        }
        if (!StringUtils.hasText(location)) {
            missing.add("location");
        }
        if (budgetMax == null) {
            missing.add("budget");
        }
        return missing;
    }

    @JsonIgnore
    public boolean hasAnySearchSlot() {
        return missingSearchSlots().size() < 3;
    }
}
