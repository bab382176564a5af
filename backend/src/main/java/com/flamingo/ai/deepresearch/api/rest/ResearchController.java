package com.flamingo.ai.deepresearch.api.rest;

import com.flamingo.ai.deepresearch.api.dto.request.ResearchRequest;
import com.flamingo.ai.deepresearch.api.dto.response.ResearchResponse;
import com.flamingo.ai.deepresearch.domain.ResearchResult;
import com.flamingo.ai.deepresearch.service.research.ResearchLoopController;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for research runs. */
@RestController
@RequestMapping("/api/research")
@RequiredArgsConstructor
public class ResearchController {

  private final ResearchLoopController researchLoopController;

  /** Runs one research loop for the topic and returns the finalized summary. Blocks until done. */
  @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ResearchResponse> research(@Valid @RequestBody ResearchRequest request) {
    ResearchResult result = researchLoopController.run(request.getTopic().strip());
    return ResponseEntity.ok(ResearchResponse.fromResult(result));
  }
}
