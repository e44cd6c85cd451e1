package io.intellixity.jobly.server.web;

import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.JoblyError;
import io.intellixity.jobly.result.JoblyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/** Renders failures as {@code {"error": {"message", "status", "kind"}}}. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String INTERNAL_MESSAGE = "Internal server error";

  @ExceptionHandler(JoblyException.class)
  public ResponseEntity<Map<String, Object>> onJobly(JoblyException e) {
    JoblyError error = e.error();
    if (!error.kind().clientCaused()) {
      log.error("jobly.http failure kind={} message={}", error.kind(), error.message(), e);
      return body(ErrorKind.INTERNAL, INTERNAL_MESSAGE);
    }
    log.debug("jobly.http rejected kind={} message={}", error.kind(), error.message());
    return body(error.kind(), error.message());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> onUnreadable(HttpMessageNotReadableException e) {
    log.debug("jobly.http unreadable body: {}", e.getMostSpecificCause().getMessage());
    return body(ErrorKind.INVALID_INPUT, "Malformed or mistyped request body");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> onTypeMismatch(MethodArgumentTypeMismatchException e) {
    return body(ErrorKind.INVALID_INPUT, "Parameter '" + e.getName() + "' has an invalid value");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnexpected(Exception e) {
    // Spring's own request errors (405, 415, unknown route, missing parameter) carry their status
    if (e instanceof ErrorResponse er && er.getStatusCode().is4xxClientError()) {
      HttpStatusCode status = er.getStatusCode();
      String detail = er.getBody().getDetail();
      log.debug("jobly.http rejected status={} message={}", status.value(), detail);
      return body(kindOf(status), status, detail == null ? e.getMessage() : detail);
    }
    log.error("jobly.http unexpected failure", e);
    return body(ErrorKind.INTERNAL, INTERNAL_MESSAGE);
  }

  static ErrorKind kindOf(HttpStatusCode status) {
    return switch (status.value()) {
      case 401 -> ErrorKind.UNAUTHORIZED;
      case 403 -> ErrorKind.FORBIDDEN;
      case 404 -> ErrorKind.NOT_FOUND;
      default -> ErrorKind.INVALID_INPUT;
    };
  }

  static HttpStatus statusOf(ErrorKind kind) {
    return switch (kind) {
      case INVALID_INPUT, INVALID_FILTER_PARAMETER, MISSING_FILTER_VALUE, REFERENCE_NOT_FOUND, DUPLICATE ->
          HttpStatus.BAD_REQUEST;
      case NOT_FOUND, EMPTY_RESULT -> HttpStatus.NOT_FOUND;
      case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
      case FORBIDDEN -> HttpStatus.FORBIDDEN;
      case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }

  private static ResponseEntity<Map<String, Object>> body(ErrorKind kind, String message) {
    return body(kind, statusOf(kind), message);
  }

  private static ResponseEntity<Map<String, Object>> body(ErrorKind kind, HttpStatusCode status, String message) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("message", message);
    error.put("status", status.value());
    error.put("kind", kind.name());
    return ResponseEntity.status(status).body(Map.of("error", error));
  }
}
