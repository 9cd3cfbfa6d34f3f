package com.pinclick.copilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pinclick.copilot.util.ConfigurationParser;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical buyer search criteria. Empty sets and nulls mean "not specified".
 */
public record FilterModel(
        @JsonProperty("bedrooms") Set<Integer> bedrooms,
        @JsonProperty("locality") String locality,
        @JsonProperty("budget_min") Long budgetMin,
        @JsonProperty("budget_max") Long budgetMax,
        @JsonProperty("property_types") Set<PropertyType> propertyTypes,
        @JsonProperty("possession_statuses") Set<PossessionStatus> possessionStatuses,
        @JsonProperty("amenities") Set<String> amenities,
        @JsonProperty("radius_km") Integer radiusKm
) {
    public static final FilterModel EMPTY = new FilterModel(null, null, null, null, null, null, null, null);

    public FilterModel {
        bedrooms = bedrooms == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(bedrooms));
        locality = StringUtils.hasText(locality) ? locality.trim() : null;
        propertyTypes = propertyTypes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(propertyTypes));
        possessionStatuses = possessionStatuses == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(possessionStatuses));
        amenities = amenities == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(amenities));
    }

    /**
     * Field-wise merge: each field of {@code update} wins when present or non-empty, otherwise
     * the {@code base} value is kept.
     */
    public static FilterModel merge(FilterModel base, FilterModel update) {
        if (base == null) {
            return update == null ? EMPTY : update;
        }
        if (update == null) {
            return base;
        }
        return new FilterModel(
                update.bedrooms().isEmpty() ? base.bedrooms() : update.bedrooms(),
                update.locality() != null ? update.locality() : base.locality(),
                update.budgetMin() != null ? update.budgetMin() : base.budgetMin(),
                update.budgetMax() != null ? update.budgetMax() : base.budgetMax(),
                update.propertyTypes().isEmpty() ? base.propertyTypes() : update.propertyTypes(),
                update.possessionStatuses().isEmpty() ? base.possessionStatuses() : update.possessionStatuses(),
                update.amenities().isEmpty() ? base.amenities() : update.amenities(),
                update.radiusKm() != null ? update.radiusKm() : base.radiusKm()
        );
    }

    /**
     * The slots a buyer states in conversation: bedrooms, locality and budget ceiling.
     */
    public static FilterModel fromRequirements(Requirements requirements) {
        if (requirements == null) {
            return EMPTY;
        }
        return new FilterModel(
                ConfigurationParser.bedrooms(requirements.getConfiguration()),
                requirements.getLocation(),
                null,
                requirements.getBudgetMax(),
                null, null, null, null);
    }

    public FilterModel withBudgetMax(Long value) {
        return new FilterModel(bedrooms, locality, budgetMin, value, propertyTypes, possessionStatuses, amenities, radiusKm);
    }

    public FilterModel withLocality(String value) {
        return new FilterModel(bedrooms, value, budgetMin, budgetMax, propertyTypes, possessionStatuses, amenities, radiusKm);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return bedrooms.isEmpty() && locality == null && budgetMin == null && budgetMax == null
                && propertyTypes.isEmpty() && possessionStatuses.isEmpty() && amenities.isEmpty() && radiusKm == null;
    }
}
