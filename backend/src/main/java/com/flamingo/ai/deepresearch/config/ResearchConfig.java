package com.flamingo.ai.deepresearch.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the research loop. Read-only once the application has started. */
@Configuration
@ConfigurationProperties(prefix = "research")
@Getter
@Setter
public class ResearchConfig {

  /** Web search provider: "tavily" or "perplexity". Validated at the start of each run. */
  private String searchProvider = "tavily";

  /** Loop ceiling compared (inclusively) against the number of completed web-research steps. */
  private int maxResearchLoops = 3;

  private Llm llm = new Llm();
  private Tavily tavily = new Tavily();
  private Perplexity perplexity = new Perplexity();
  private Youtube youtube = new Youtube();
  private Email email = new Email();
  private Http http = new Http();

  @Getter
  @Setter
  public static class Llm {
    /** Model backend: "ollama" (default, local) or "openai". */
    private String provider = "ollama";

    private String modelName = "llama3.2";
    private String baseUrl = "http://localhost:11434";
    private String apiKey = "";
    private double temperature = 0.0;
    private int timeoutSeconds = 120;
  }

  @Getter
  @Setter
  public static class Tavily {
    private String apiKey = "";
    private String baseUrl = "https://api.tavily.com";
    private int maxResults = 1;
    private boolean includeRawContent = true;
    private int maxTokensPerSource = 1000;
  }

  @Getter
  @Setter
  public static class Perplexity {
    private String apiKey = "";
    private String baseUrl = "https://api.perplexity.ai";
    private String model = "sonar-pro";
    private int maxTokensPerSource = 1000;
  }

  @Getter
  @Setter
  public static class Youtube {
    /** Optional. Video research is skipped when absent. */
    private String apiKey = "";

    private String baseUrl = "https://www.googleapis.com/youtube/v3";
    private int maxResults = 3;
    private int transcriptTimeoutSeconds = 10;
    private List<String> transcriptLanguages = new ArrayList<>(List.of("en"));
    private int maxTokensPerSource = 500;

    public boolean isEnabled() {
      return apiKey != null && !apiKey.isBlank();
    }
  }

  @Getter
  @Setter
  public static class Email {
    /** When false the delivery step is a no-op. */
    private boolean enabled = true;

    private String recipient = "";
    private String smtpServer = "smtp.gmail.com";
    private int smtpPort = 587;
    private String smtpUsername = "";
    private String smtpPassword = "";
  }

  @Getter
  @Setter
  public static class Http {
    private int readTimeoutSeconds = 30;
    private int maxInMemorySizeBytes = 4 * 1024 * 1024;
  }
}
