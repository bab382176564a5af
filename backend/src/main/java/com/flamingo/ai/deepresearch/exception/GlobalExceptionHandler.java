package com.flamingo.ai.deepresearch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ResearchRunException.class)
  public ResponseEntity<ApiError> handleResearchRun(
      ResearchRunException ex, HttpServletRequest request) {

    Throwable cause = ex.getCause();
    HttpStatus status;
    String code;
    String message;
    String errorType;

    if (cause instanceof MalformedModelOutputException malformed) {
      status = HttpStatus.BAD_GATEWAY;
      code = ApiError.MALFORMED_MODEL_OUTPUT;
      message = malformed.getUserMessage();
      errorType = "malformed_model_output";
    } else if (cause instanceof LlmServiceException llm) {
      status = HttpStatus.SERVICE_UNAVAILABLE;
      code = ApiError.LLM_UNAVAILABLE;
      message = llm.getUserMessage();
      errorType = "llm_error";
    } else if (cause instanceof EvidenceSourceUnavailableException search) {
      status = HttpStatus.SERVICE_UNAVAILABLE;
      code = ApiError.SEARCH_UNAVAILABLE;
      message = search.getUserMessage();
      errorType = "search_unavailable";
    } else if (cause instanceof DeliveryFailedException delivery) {
      status = HttpStatus.BAD_GATEWAY;
      code = ApiError.DELIVERY_FAILED;
      message = delivery.getUserMessage();
      errorType = "delivery_failed";
    } else if (cause instanceof ConfigurationException config) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
      code = ApiError.CONFIGURATION_ERROR;
      message = config.getUserMessage();
      errorType = "configuration_error";
    } else {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
      code = ApiError.RESEARCH_FAILED;
      message = "Research run failed. Please try again later.";
      errorType = "research_failed";
    }

    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error(
        "Research run {} failed [{}] at {}: {}",
        ex.getRunId(),
        errorId,
        ex.getStep(),
        ex.getMessage());

    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .runId(ex.getRunId())
                .stage(ex.getStep().name())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("configuration_error");
    String errorId = generateErrorId();
    log.error("Configuration error [{}] for {}: {}", errorId, ex.getProperty(), ex.getMessage());

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.CONFIGURATION_ERROR)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
