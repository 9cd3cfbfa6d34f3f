package com.pinclick.copilot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pinclick.copilot.model.StoreMode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "Session store health; IN_MEMORY mode is degraded and not shared across instances")
public class StoreHealthResponse {

    @JsonProperty("status")
    @Schema(example = "healthy")
    private String status;

    @JsonProperty("mode")
    private StoreMode mode;

    @JsonProperty("durable_reachable")
    private boolean durableReachable;

    @JsonProperty("active_sessions_in_memory")
    private int activeSessionsInMemory;
}
