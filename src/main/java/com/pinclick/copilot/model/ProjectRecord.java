package com.pinclick.copilot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Catalog row for one residential project. Read-only from the engine's point of view.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "projects")
public class ProjectRecord {

    @Id
    @Column(name = "project_id", nullable = false, updatable = false)
    private String projectId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "developer")
    private String developer;

    @Column(name = "location")
    private String location;

    @Column(name = "zone")
    private String zone;

    @Column(name = "configuration")
    private String configuration; // e.g. "2, 3 BHK"

    @Column(name = "budget_min")
    private Long budgetMin;

    @Column(name = "budget_max")
    private Long budgetMax;

    @Column(name = "possession_year")
    private Integer possessionYear;

    @Column(name = "possession_quarter")
    private String possessionQuarter;

    @Enumerated(EnumType.STRING)
    @Column(name = "status")
    private PossessionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "property_type")
    private PropertyType propertyType;

    @Convert(converter = StringListConverter.class)
    @Column(name = "amenities", columnDefinition = "TEXT")
    private List<String> amenities;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "rera_number")
    private String reraNumber;

    @Column(name = "usp", columnDefinition = "TEXT")
    private String usp;
}
