package com.pinclick.copilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pinclick.copilot.util.ConfigurationParser;

import java.util.List;
import java.util.Set;

/**
 * Immutable, serializable view of a catalog project as the engine ranks and remembers it.
 */
public record ProjectSummary(
        @JsonProperty("project_id") String projectId,
        @JsonProperty("name") String name,
        @JsonProperty("developer") String developer,
        @JsonProperty("location") String location,
        @JsonProperty("zone") String zone,
        @JsonProperty("configuration") String configuration,
        @JsonProperty("budget_min") Long budgetMin,
        @JsonProperty("budget_max") Long budgetMax,
        @JsonProperty("possession_year") Integer possessionYear,
        @JsonProperty("possession_quarter") String possessionQuarter,
        @JsonProperty("status") PossessionStatus status,
        @JsonProperty("property_type") PropertyType propertyType,
        @JsonProperty("amenities") List<String> amenities,
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("rera_number") String reraNumber
) {
    public List<String> amenities() {
        return amenities == null ? List.of() : amenities;
    }

    @JsonIgnore
    public Set<Integer> bedroomOptions() {
        return ConfigurationParser.bedrooms(configuration);
    }

    @JsonIgnore
    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    @JsonIgnore
    public Coordinates coordinates() {
        return hasCoordinates() ? new Coordinates(latitude, longitude) : null;
    }

    public static ProjectSummary from(ProjectRecord record) {
        return new ProjectSummary(
                record.getProjectId(),
                record.getName(),
                record.getDeveloper(),
                record.getLocation(),
                record.getZone(),
                record.getConfiguration(),
                record.getBudgetMin(),
                record.getBudgetMax(),
                record.getPossessionYear(),
                record.getPossessionQuarter(),
                record.getStatus(),
                record.getPropertyType(),
                record.getAmenities() == null ? List.of() : List.copyOf(record.getAmenities()),
                record.getLatitude(),
                record.getLongitude(),
                record.getReraNumber()
        );
    }
}
