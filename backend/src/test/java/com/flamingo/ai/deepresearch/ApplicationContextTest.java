package com.flamingo.ai.deepresearch;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deepresearch.agent.QueryWriterAgent;
import com.flamingo.ai.deepresearch.agent.ReflectionAgent;
import com.flamingo.ai.deepresearch.agent.SummarizerAgent;
import com.flamingo.ai.deepresearch.service.delivery.DeliveryNotifier;
import com.flamingo.ai.deepresearch.service.research.ResearchLoopController;
import com.flamingo.ai.deepresearch.service.search.SearchApi;
import com.flamingo.ai.deepresearch.service.search.WebResearchService;
import com.flamingo.ai.deepresearch.service.video.VideoResearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Integration test that verifies the Spring application context loads correctly. The LLM agents
 * are mocked so the test runs without a model server.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private QueryWriterAgent queryWriterAgent;
  @MockitoBean private SummarizerAgent summarizerAgent;
  @MockitoBean private ReflectionAgent reflectionAgent;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Research loop and its collaborators should be available")
  void researchBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ResearchLoopController.class)).isNotNull();
    assertThat(applicationContext.getBean(DeliveryNotifier.class)).isNotNull();
    assertThat(applicationContext.getBean(VideoResearchService.class)).isNotNull();
  }

  @Test
  @DisplayName("Both web search providers should be registered")
  void searchProvidersShouldBeRegistered() {
    WebResearchService webResearchService = applicationContext.getBean(WebResearchService.class);
    assertThat(webResearchService.activeProvider().id()).isEqualTo(SearchApi.TAVILY);
  }
}
