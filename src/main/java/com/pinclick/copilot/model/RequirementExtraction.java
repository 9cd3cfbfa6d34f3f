package com.pinclick.copilot.model;

import java.util.Set;

/**
 * Fields the requirement extractor was confident about for one message. Nulls and empty
 * sets mean "not mentioned".
 */
public record RequirementExtraction(
        String configuration,
        String location,
        Long budgetMin,
        Long budgetMax,
        String projectName,
        String featureRequested,
        Set<PropertyType> propertyTypes,
        Set<PossessionStatus> possessionStatuses,
        Set<String> amenities
) {
    public static RequirementExtraction empty() {
        return new RequirementExtraction(null, null, null, null, null, null, Set.of(), Set.of(), Set.of());
    }

    public Requirements toRequirements() {
        return new Requirements(configuration, location, budgetMax, projectName, featureRequested);
    }

    /**
     * Non-slot refinements (budget floor, type, status, amenities) as a filter snapshot.
     */
    public FilterModel toRefinements() {
        return new FilterModel(null, null, budgetMin, null, propertyTypes, possessionStatuses, amenities, null);
    }
}
