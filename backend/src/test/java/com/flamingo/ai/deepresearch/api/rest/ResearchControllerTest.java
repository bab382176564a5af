package com.flamingo.ai.deepresearch.api.rest;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.api.dto.request.ResearchRequest;
import com.flamingo.ai.deepresearch.domain.ResearchResult;
import com.flamingo.ai.deepresearch.domain.ResearchStep;
import com.flamingo.ai.deepresearch.exception.ConfigurationException;
import com.flamingo.ai.deepresearch.exception.EvidenceSourceUnavailableException;
import com.flamingo.ai.deepresearch.exception.GlobalExceptionHandler;
import com.flamingo.ai.deepresearch.exception.MalformedModelOutputException;
import com.flamingo.ai.deepresearch.exception.ResearchRunException;
import com.flamingo.ai.deepresearch.service.research.ResearchLoopController;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResearchController Tests")
class ResearchControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private MeterRegistry meterRegistry;

  @Mock private ResearchLoopController researchLoopController;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ResearchController(researchLoopController))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("should return the finalized summary")
  void shouldReturnSummary() throws Exception {
    when(researchLoopController.run("quantum dots"))
        .thenReturn(
            new ResearchResult(
                "ab12cd34",
                "quantum dots",
                "## Summary\n\nBody\n\n### Sources:\n* A : a",
                2,
                true));

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        ResearchRequest.builder().topic("  quantum dots ").build())))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.runId").value("ab12cd34"))
        .andExpect(jsonPath("$.loopCount").value(2))
        .andExpect(jsonPath("$.delivered").value(true))
        .andExpect(jsonPath("$.summary").value("## Summary\n\nBody\n\n### Sources:\n* A : a"));
  }

  @Test
  @DisplayName("should reject a blank topic")
  void shouldRejectBlankTopic() throws Exception {
    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\": \"   \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(researchLoopController, never()).run(anyString());
  }

  @Test
  @DisplayName("should map an unavailable search provider to 503 with the failed step")
  void shouldMapSearchFailure() throws Exception {
    when(researchLoopController.run("topic"))
        .thenThrow(
            new ResearchRunException(
                "run1",
                ResearchStep.WEB_RESEARCH,
                new EvidenceSourceUnavailableException("tavily", "HTTP 401")));

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\": \"topic\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.code").value("SEARCH_001"))
        .andExpect(jsonPath("$.runId").value("run1"))
        .andExpect(jsonPath("$.stage").value("WEB_RESEARCH"));
  }

  @Test
  @DisplayName("should map malformed model output to 502")
  void shouldMapMalformedOutput() throws Exception {
    when(researchLoopController.run("topic"))
        .thenThrow(
            new ResearchRunException(
                "run1",
                ResearchStep.GENERATE_QUERY,
                new MalformedModelOutputException("query-writer", "no query field")));

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\": \"topic\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.code").value("LLM_001"));
  }

  @Test
  @DisplayName("should report missing configuration before research starts as 500")
  void shouldMapConfigurationError() throws Exception {
    when(researchLoopController.run("topic"))
        .thenThrow(
            new ConfigurationException("research.email.recipient", "Recipient not configured"));

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\": \"topic\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.code").value("CONFIG_001"));
  }
}
