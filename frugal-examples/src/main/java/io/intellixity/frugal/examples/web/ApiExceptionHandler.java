package io.intellixity.frugal.examples.web;

import io.intellixity.frugal.access.exec.CallTimeoutException;
import io.intellixity.frugal.access.exec.DataStoreException;
import io.intellixity.frugal.access.exec.UnsupportedPushdownException;
import io.intellixity.frugal.access.query.QueryValidationException;
import io.intellixity.frugal.access.registry.ResourceExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Maps the access-layer error taxonomy onto HTTP statuses. Nothing is retried here. */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({QueryValidationException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, String>> invalid(RuntimeException e) {
    return error(HttpStatus.BAD_REQUEST, "INVALID_QUERY", e);
  }

  @ExceptionHandler(UnsupportedPushdownException.class)
  public ResponseEntity<Map<String, String>> unsupported(UnsupportedPushdownException e) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, "UNSUPPORTED_PUSHDOWN", e);
  }

  @ExceptionHandler(ResourceExhaustedException.class)
  public ResponseEntity<Map<String, String>> exhausted(ResourceExhaustedException e) {
    log.warn("frugal.api resource exhausted kind={}", e.kind());
    return error(HttpStatus.SERVICE_UNAVAILABLE, "RESOURCE_EXHAUSTED", e);
  }

  @ExceptionHandler(CallTimeoutException.class)
  public ResponseEntity<Map<String, String>> timeout(CallTimeoutException e) {
    return error(HttpStatus.GATEWAY_TIMEOUT, "TIMEOUT", e);
  }

  @ExceptionHandler(DataStoreException.class)
  public ResponseEntity<Map<String, String>> store(DataStoreException e) {
    log.error("frugal.api data store failure", e);
    return error(HttpStatus.BAD_GATEWAY, "DATA_STORE_ERROR", e);
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, RuntimeException e) {
    return ResponseEntity.status(status).body(Map.of("code", code, "message", String.valueOf(e.getMessage())));
  }
}
