package com.wirecrest.scraper.schedule.api;

import com.wirecrest.scraper.schedule.model.InvalidTargetTypeException;
import com.wirecrest.scraper.schedule.platform.JobPlatformException;
import com.wirecrest.scraper.schedule.service.ScheduleNotFoundException;
import com.wirecrest.scraper.schedule.service.WebhookAuthenticationException;
import com.wirecrest.scraper.schedule.service.WebhookProcessingException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SchedulerExceptionHandler {

  @ExceptionHandler(ScheduleNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(ScheduleNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "schedule_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidTargetTypeException.class)
  public ResponseEntity<Map<String, String>> handleInvalidTargetType(InvalidTargetTypeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_target_type", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<Map<String, String>> handleConflict(IllegalStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "conflict", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(WebhookAuthenticationException.class)
  public ResponseEntity<Map<String, String>> handleForbidden(WebhookAuthenticationException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(Map.of("error", "forbidden", "message", ex.getMessage()));
  }

  @ExceptionHandler(WebhookProcessingException.class)
  public ResponseEntity<Map<String, String>> handleWebhookFailure(WebhookProcessingException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "webhook_processing_failed", "runId", String.valueOf(ex.getRunId())));
  }

  @ExceptionHandler(JobPlatformException.class)
  public ResponseEntity<Map<String, String>> handlePlatformFailure(JobPlatformException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "job_platform_" + ex.getCode(), "message", String.valueOf(ex.getMessage())));
  }
}
