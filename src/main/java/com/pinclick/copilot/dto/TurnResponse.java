package com.pinclick.copilot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pinclick.copilot.model.ConfidenceTier;
import com.pinclick.copilot.model.FallbackStage;
import com.pinclick.copilot.model.FlowNode;
import com.pinclick.copilot.model.Intent;
import com.pinclick.copilot.model.RankedProject;
import com.pinclick.copilot.model.RefusalReason;
import com.pinclick.copilot.model.Requirements;
import com.pinclick.copilot.model.StoreMode;
import com.pinclick.copilot.model.TurnOutcome;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Structured result of one turn. Rendering it into prose is the caller's job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Structured outcome of a conversational turn")
public class TurnResponse {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("outcome")
    private TurnOutcome outcome;

    @JsonProperty("intent")
    private Intent intent;

    @JsonProperty("intent_confidence")
    private Double intentConfidence;

    @JsonProperty("node")
    private FlowNode node;

    @JsonProperty("next_redirection")
    private FlowNode nextRedirection;

    @JsonProperty("message")
    @Schema(description = "Fixed message for refusals and degraded service")
    private String message;

    @JsonProperty("refusal_reason")
    private RefusalReason refusalReason;

    @JsonProperty("confidence")
    private ConfidenceTier confidence;

    @JsonProperty("confidence_note")
    private String confidenceNote;

    @JsonProperty("projects")
    private List<RankedProject> projects;

    @JsonProperty("fallback_stage")
    private FallbackStage fallbackStage;

    @JsonProperty("relaxation_multiplier")
    private Double relaxationMultiplier;

    @JsonProperty("relaxation_explanation")
    private String relaxationExplanation;

    @JsonProperty("suggested_budget")
    private Long suggestedBudget;

    @JsonProperty("anchor_location")
    private String anchorLocation;

    @JsonProperty("radius_km")
    private Double radiusKm;

    @JsonProperty("pagination_offset")
    private Integer paginationOffset;

    @JsonProperty("total_results")
    private Integer totalResults;

    @JsonProperty("has_more")
    private Boolean hasMore;

    @JsonProperty("selected_project_name")
    private String selectedProjectName;

    @JsonProperty("feature_requested")
    private String featureRequested;

    @JsonProperty("requirements")
    private Requirements requirements;

    @JsonProperty("missing_requirements")
    private List<String> missingRequirements;

    @JsonProperty("store_mode")
    private StoreMode storeMode;

    public List<RankedProject> getProjects() {
        return projects == null ? List.of() : projects;
    }
}
