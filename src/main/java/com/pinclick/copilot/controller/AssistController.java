package com.pinclick.copilot.controller;

import com.pinclick.copilot.dto.StoreHealthResponse;
import com.pinclick.copilot.dto.TurnRequest;
import com.pinclick.copilot.dto.TurnResponse;
import com.pinclick.copilot.service.AssistService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/assist")
@Tag(name = "Assist", description = "Conversational sales copilot for property search calls")
public class AssistController {

    private final AssistService assistService;

    public AssistController(AssistService assistService) {
        this.assistService = assistService;
    }

    @Operation(
            summary = "Process one conversational turn",
            description = "Classifies the message, updates the session's requirements and returns ranked projects, " +
                    "a refusal, or the next conversational step. Explicit filters override values read from the message."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Turn processed",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = TurnResponse.class))),
            @ApiResponse(responseCode = "400", description = "Bad request - message is null or empty",
                    content = @Content),
            @ApiResponse(responseCode = "409", description = "Another turn for the session is still running",
                    content = @Content),
            @ApiResponse(responseCode = "500", description = "Turn failed; session state left unchanged",
                    content = @Content)
    })
    @PostMapping
    public ResponseEntity<TurnResponse> assist(@RequestBody(required = false) TurnRequest request) {
        if (request == null || !StringUtils.hasText(request.getMessage())) {
            return ResponseEntity.badRequest().build();
        }
        TurnResponse response = assistService.handle(request);
        switch (response.getOutcome()) {
            case FAILURE:
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
            case SESSION_BUSY:
                return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
            default:
                return ResponseEntity.ok(response);
        }
    }

    @Operation(summary = "Reset a session", description = "Drops the stored conversation context for the session id.")
    @ApiResponse(responseCode = "204", description = "Session reset")
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> reset(
            @Parameter(description = "Session (call) id", required = true) @PathVariable String sessionId) {
        assistService.reset(sessionId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Session store health",
            description = "Reports whether sessions are stored durably or in the degraded in-memory mode.")
    @GetMapping("/health")
    public StoreHealthResponse health() {
        return assistService.health();
    }
}
