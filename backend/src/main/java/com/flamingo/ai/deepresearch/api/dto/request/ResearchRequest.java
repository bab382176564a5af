package com.flamingo.ai.deepresearch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a research run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRequest {

  @NotBlank(message = "Topic is required")
  @Size(min = 1, max = 500, message = "Topic must be between 1 and 500 characters")
  private String topic;
}
