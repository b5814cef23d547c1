package io.intellixity.fetchgraph.examples.web;

import io.intellixity.fetchgraph.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Maps rejected selectors and sketches to 400 {@code {error, message}}. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({QueryValidationException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
    log.debug("fetchgraph.examples op=reject type={} message={}", e.getClass().getSimpleName(), e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
  }
}
