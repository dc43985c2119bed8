package com.meridian.controller;

import com.meridian.counter.MonotonicClock;
import com.meridian.exception.DecisionNotFoundException;
import com.meridian.model.CostEfficiency;
import com.meridian.model.DecisionFactor;
import com.meridian.model.DecisionFilter;
import com.meridian.model.RoutingDecision;
import com.meridian.model.TaskCategory;
import com.meridian.model.dto.DecisionExplanation;
import com.meridian.model.dto.DecisionSummary;
import com.meridian.service.DecisionLogService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web slice tests for decision history and explanations.
 */
@WebMvcTest(DecisionController.class)
class DecisionControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DecisionLogService decisionLog;

    @MockBean
    private MonotonicClock clock;

    @Test
    @DisplayName("should pass history filters to the decision log")
    void shouldFilterHistory() throws Exception {
        when(decisionLog.getHistory(eq("org-acme"), any())).thenReturn(List.of(RoutingDecision.builder()
                .decisionId("d-1")
                .taskCategory(TaskCategory.CHAT)
                .provider("anthropic")
                .model("claude-3-haiku")
                .build()));

        mockMvc.perform(get("/v1/decisions/org-acme")
                        .param("taskCategory", "chat")
                        .param("provider", "anthropic")
                        .param("from", "2026-03-01T00:00:00Z")
                        .param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].decisionId").value("d-1"));

        ArgumentCaptor<DecisionFilter> filter = ArgumentCaptor.forClass(DecisionFilter.class);
        verify(decisionLog).getHistory(eq("org-acme"), filter.capture());
        assertEquals(TaskCategory.CHAT, filter.getValue().getTaskCategory());
        assertEquals("anthropic", filter.getValue().getProvider());
        assertEquals(Instant.parse("2026-03-01T00:00:00Z"), filter.getValue().getFrom());
        assertEquals(20, filter.getValue().getLimit());
    }

    @Test
    @DisplayName("should reject unknown task categories")
    void shouldRejectUnknownCategory() throws Exception {
        mockMvc.perform(get("/v1/decisions/org-acme").param("taskCategory", "poetry"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("should default the summary window to seven days")
    void shouldDefaultSummaryWindow() throws Exception {
        when(clock.instant()).thenReturn(NOW);
        when(decisionLog.summary(any(), any(), any())).thenReturn(DecisionSummary.builder()
                .organizationId("org-acme")
                .totalDecisions(12)
                .build());

        mockMvc.perform(get("/v1/decisions/org-acme/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalDecisions").value(12));

        verify(decisionLog).summary("org-acme", NOW.minus(Duration.ofDays(7)), NOW);
    }

    @Test
    @DisplayName("should explain a decision")
    void shouldExplainDecision() throws Exception {
        when(decisionLog.explain("d-1")).thenReturn(DecisionExplanation.builder()
                .decision(RoutingDecision.builder().decisionId("d-1").model("gpt-4o-mini").build())
                .explanation("Decision for drafting-short task:")
                .insights(DecisionExplanation.Insights.builder()
                        .primaryFactor(DecisionFactor.COST)
                        .costEfficiency(CostEfficiency.GOOD)
                        .alternativesConsidered(2)
                        .modelsFiltered(1)
                        .build())
                .build());

        mockMvc.perform(get("/v1/decisions/explain/d-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.insights.primaryFactor").value("cost"))
                .andExpect(jsonPath("$.insights.costEfficiency").value("good"));
    }

    @Test
    @DisplayName("should return 404 for unknown decisions")
    void shouldReturnNotFound() throws Exception {
        when(decisionLog.explain("missing")).thenThrow(new DecisionNotFoundException("missing"));

        mockMvc.perform(get("/v1/decisions/explain/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Decision Not Found"));
    }
}
