package com.pinclick.copilot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

@Data
@Schema(description = "Explicit filters chosen by the agent in the UI. They override anything read from the message.")
public class QuickFilters {

    @JsonProperty("price_range")
    @Schema(description = "[min, max] in rupees; either bound may be null", example = "[5000000, 12000000]")
    private List<Long> priceRange;

    @JsonProperty("bhk")
    @Schema(description = "Bedroom configurations", example = "[\"2BHK\", \"3BHK\"]")
    private List<String> bhk;

    @JsonProperty("status")
    @Schema(description = "Possession status labels", example = "[\"Ready to Move\"]")
    private List<String> status;

    @JsonProperty("property_type")
    @Schema(description = "Property types", example = "[\"Apartment\"]")
    private List<String> propertyType;

    @JsonProperty("amenities")
    private List<String> amenities;

    @JsonProperty("locality")
    @Schema(description = "Micro-location or zone", example = "Whitefield")
    private String locality;

    @JsonProperty("radius_km")
    @Schema(description = "Radius for nearby searches", example = "10")
    private Integer radiusKm;
}
