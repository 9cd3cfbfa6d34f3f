package com.pinclick.copilot.controller;

import com.pinclick.copilot.dto.StoreHealthResponse;
import com.pinclick.copilot.dto.TurnRequest;
import com.pinclick.copilot.dto.TurnResponse;
import com.pinclick.copilot.model.StoreMode;
import com.pinclick.copilot.model.TurnOutcome;
import com.pinclick.copilot.service.AssistService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AssistControllerTest {

    @Mock
    private AssistService assistService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AssistController(assistService)).build();
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/assist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\": \"call-1\", \"message\": \"  \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(assistService);
    }

    @Test
    void processedTurnIsReturned() throws Exception {
        when(assistService.handle(any(TurnRequest.class))).thenReturn(TurnResponse.builder()
                .sessionId("call-1")
                .outcome(TurnOutcome.RESULTS)
                .totalResults(7)
                .hasMore(true)
                .build());

        mockMvc.perform(post("/api/assist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\": \"call-1\", \"message\": \"2bhk in whitefield\","
                                + " \"filters\": {\"bhk\": [\"2\"]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("RESULTS"))
                .andExpect(jsonPath("$.total_results").value(7))
                .andExpect(jsonPath("$.has_more").value(true));
    }

    @Test
    void failedTurnMapsToServerError() throws Exception {
        when(assistService.handle(any(TurnRequest.class))).thenReturn(TurnResponse.builder()
                .sessionId("call-1").outcome(TurnOutcome.FAILURE).message("Something went wrong").build());

        mockMvc.perform(post("/api/assist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\": \"call-1\", \"message\": \"2bhk\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.outcome").value("FAILURE"));
    }

    @Test
    void busySessionMapsToConflict() throws Exception {
        when(assistService.handle(any(TurnRequest.class))).thenReturn(TurnResponse.builder()
                .sessionId("call-1").outcome(TurnOutcome.SESSION_BUSY).build());

        mockMvc.perform(post("/api/assist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\": \"call-1\", \"message\": \"more\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void resetAndHealth() throws Exception {
        when(assistService.health()).thenReturn(new StoreHealthResponse("degraded", StoreMode.IN_MEMORY, false, 3));

        mockMvc.perform(delete("/api/assist/call-1")).andExpect(status().isNoContent());
        mockMvc.perform(get("/api/assist/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("IN_MEMORY"))
                .andExpect(jsonPath("$.active_sessions_in_memory").value(3));

        verify(assistService).reset("call-1");
    }
}
