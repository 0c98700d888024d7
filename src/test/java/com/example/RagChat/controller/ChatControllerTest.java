package com.example.RagChat.controller;

import com.example.RagChat.model.BlockReason;
import com.example.RagChat.model.ChatResponse;
import com.example.RagChat.model.SessionBackend;
import com.example.RagChat.model.TurnAudit;
import com.example.RagChat.model.TurnState;
import com.example.RagChat.service.ConversationOrchestrator;
import com.example.RagChat.service.TurnAuditService;
import com.example.RagChat.session.SessionStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ChatController.class, SessionController.class})
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationOrchestrator orchestrator;

    @MockBean
    private SessionStore sessionStore;

    @MockBean
    private TurnAuditService turnAuditService;

    @Test
    void blockedTurnIsStillOk() throws Exception {
        when(orchestrator.chat("alice", "hack the planet")).thenReturn(ChatResponse.blocked(
                "I can't help with that request: message contains blocked content.",
                BlockReason.INPUT_GUARDRAIL, List.of(), SessionBackend.DEGRADED));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"alice\",\"query\":\"hack the planet\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocked").value(true))
                .andExpect(jsonPath("$.blockReason").value("INPUT_GUARDRAIL"))
                .andExpect(jsonPath("$.sessionBackend").value("degraded"));
    }

    @Test
    void missingUserIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"hello\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void invalidHistoryLimitIsBadRequest() throws Exception {
        when(sessionStore.history("alice", 0)).thenThrow(new IllegalArgumentException("limit must be positive: 0"));

        mockMvc.perform(get("/api/sessions/alice/history").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statsOfUnknownUserIsNotFound() throws Exception {
        when(sessionStore.stats("nobody")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sessions/nobody/stats"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteExpiresSession() throws Exception {
        mockMvc.perform(delete("/api/sessions/alice"))
                .andExpect(status().isNoContent());

        verify(sessionStore).expire("alice");
    }

    @Test
    void backendIsReported() throws Exception {
        when(sessionStore.backend()).thenReturn(SessionBackend.DURABLE);

        mockMvc.perform(get("/api/sessions/backend"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("durable"));
    }

    @Test
    void recentTurnsAreListed() throws Exception {
        TurnAudit audit = new TurnAudit();
        audit.setUserId("alice");
        audit.setState(TurnState.BLOCKED);
        audit.setBlockReason(BlockReason.OUTPUT_GUARDRAIL);
        when(turnAuditService.recent("alice")).thenReturn(List.of(audit));

        mockMvc.perform(get("/api/sessions/alice/turns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].state").value("BLOCKED"))
                .andExpect(jsonPath("$[0].blockReason").value("OUTPUT_GUARDRAIL"));
    }
}
