package com.pinclick.copilot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One conversational turn from the sales agent")
public class TurnRequest {

    @JsonProperty("session_id")
    @Schema(description = "Stable conversation id (call id)", required = true, example = "call-8841")
    private String sessionId;

    @JsonProperty("message")
    @Schema(description = "Free-text message", required = true, example = "2BHK in Whitefield under 1.2 Cr")
    private String message;

    @JsonProperty("filters")
    @Schema(description = "Optional explicit filters")
    private QuickFilters filters;
}
