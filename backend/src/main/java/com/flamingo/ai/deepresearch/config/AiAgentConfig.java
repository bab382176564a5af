package com.flamingo.ai.deepresearch.config;

import com.flamingo.ai.deepresearch.agent.QueryWriterAgent;
import com.flamingo.ai.deepresearch.agent.ReflectionAgent;
import com.flamingo.ai.deepresearch.agent.SummarizerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the research agents using LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare prompts with @SystemMessage/@UserMessage; concrete
 * implementations come from AiServices.builder(). Structured agents use the JSON-mode model,
 * the summarizer uses the text model.
 */
@Configuration
public class AiAgentConfig {

  /** Initial query writer. Structured output. */
  @Bean
  public QueryWriterAgent queryWriterAgent(ChatModel chatModel) {
    return AiServices.builder(QueryWriterAgent.class).chatModel(chatModel).build();
  }

  /** Reflection agent producing the next query. Structured output. */
  @Bean
  public ReflectionAgent reflectionAgent(ChatModel chatModel) {
    return AiServices.builder(ReflectionAgent.class).chatModel(chatModel).build();
  }

  /** Summarizer. Uses textChatModel (no JSON response format) for free-form output. */
  @Bean
  public SummarizerAgent summarizerAgent(@Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(SummarizerAgent.class).chatModel(textChatModel).build();
  }
}
