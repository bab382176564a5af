package com.flamingo.ai.deepresearch.config;

import com.flamingo.ai.deepresearch.exception.ConfigurationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration for LangChain4j models. Two chat models are exposed: the primary one constrained to
 * JSON output for structured agents, and {@code textChatModel} for free-form text.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  static final String OLLAMA = "ollama";
  static final String OPENAI = "openai";

  private final ResearchConfig researchConfig;

  @Bean
  @Primary
  public ChatModel chatModel() {
    return buildChatModel(true);
  }

  @Bean
  public ChatModel textChatModel() {
    return buildChatModel(false);
  }

  private ChatModel buildChatModel(boolean jsonMode) {
    ResearchConfig.Llm llm = researchConfig.getLlm();
    String provider = llm.getProvider() == null ? "" : llm.getProvider().trim().toLowerCase();
    Duration timeout = Duration.ofSeconds(llm.getTimeoutSeconds());

    log.info(
        "Building {} chat model: provider={}, model={}",
        jsonMode ? "JSON" : "text",
        provider,
        llm.getModelName());

    return switch (provider) {
      case OLLAMA -> {
        var builder =
            OllamaChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .modelName(llm.getModelName())
                .temperature(llm.getTemperature())
                .timeout(timeout);
        if (jsonMode) {
          builder.responseFormat(ResponseFormat.JSON);
        }
        yield builder.build();
      }
      case OPENAI -> {
        validateApiKey(llm);
        var builder =
            OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModelName())
                .temperature(llm.getTemperature())
                .timeout(timeout)
                .logRequests(false)
                .logResponses(false);
        if (jsonMode) {
          builder.responseFormat("json_object");
        }
        yield builder.build();
      }
      default ->
          throw new ConfigurationException(
              "research.llm.provider",
              "Unsupported LLM provider: '" + llm.getProvider() + "' (expected ollama or openai)");
    };
  }

  private void validateApiKey(ResearchConfig.Llm llm) {
    if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
      throw new ConfigurationException(
          "research.llm.api-key",
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
