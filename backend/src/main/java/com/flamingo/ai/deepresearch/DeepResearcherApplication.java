package com.flamingo.ai.deepresearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeepResearcherApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeepResearcherApplication.class, args);
  }
}
