package io.intellixity.tally.examples.web;

import io.intellixity.tally.error.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps library errors to HTTP status codes with a {@code {code, message}} body. */
@RestControllerAdvice
public class TallyExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(TallyExceptionHandler.class);

  public record ErrorResponse(String code, String message) {}

  @ExceptionHandler(TallyException.class)
  public ResponseEntity<ErrorResponse> tally(TallyException e) {
    HttpStatus status = statusOf(e);
    if (status.is5xxServerError()) log.error("tally.web op=ERROR type={} msg={}", e.getClass().getSimpleName(), e.getMessage(), e);
    else log.warn("tally.web op=REJECTED type={} msg={}", e.getClass().getSimpleName(), e.getMessage());
    return ResponseEntity.status(status).body(new ErrorResponse(e.getClass().getSimpleName(), e.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
    log.warn("tally.web op=REJECTED type=IllegalArgumentException msg={}", e.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
  }

  static HttpStatus statusOf(TallyException e) {
    if (e instanceof SerializationException || e instanceof MetricValidationException) return HttpStatus.BAD_REQUEST;
    if (e instanceof UnsupportedFeatureException) return HttpStatus.UNPROCESSABLE_ENTITY;
    if (e instanceof QueryCancelledException) return HttpStatus.SERVICE_UNAVAILABLE;
    if (e instanceof SchemaException) return HttpStatus.NOT_FOUND;
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
