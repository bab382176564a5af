package com.flamingo.ai.deepresearch.api.rest;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and the active research settings. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final ResearchConfig researchConfig;

  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "deep-researcher");
    health.put("searchProvider", researchConfig.getSearchProvider());
    health.put("model", researchConfig.getLlm().getModelName());
    health.put("maxResearchLoops", researchConfig.getMaxResearchLoops());
    health.put("videoResearch", researchConfig.getYoutube().isEnabled());
    return ResponseEntity.ok(health);
  }
}
