package com.pinclick.copilot.model;

import java.util.Set;

/**
 * Predicate sent to the catalog store. Localities match as case-insensitive substrings of
 * either the project location or its zone; any one matching locality admits a project.
 */
public record CatalogQuery(
        Set<Integer> bedrooms,
        Set<String> localities,
        Long budgetMin,
        Long budgetMax,
        Set<PropertyType> propertyTypes,
        Set<PossessionStatus> possessionStatuses
) {
    public CatalogQuery {
        bedrooms = bedrooms == null ? Set.of() : Set.copyOf(bedrooms);
        localities = localities == null ? Set.of() : Set.copyOf(localities);
        propertyTypes = propertyTypes == null ? Set.of() : Set.copyOf(propertyTypes);
        possessionStatuses = possessionStatuses == null ? Set.of() : Set.copyOf(possessionStatuses);
    }

    public static CatalogQuery all() {
        return new CatalogQuery(null, null, null, null, null, null);
    }
}
