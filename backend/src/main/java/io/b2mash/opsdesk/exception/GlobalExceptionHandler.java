package io.b2mash.opsdesk.exception;

import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.health.HealthController.HealthResponse;
import io.b2mash.opsdesk.member.MemberContextNotBoundException;
import io.b2mash.opsdesk.store.StoreKind;
import io.b2mash.opsdesk.store.relational.RelationalStoreAdapter;
import jakarta.servlet.http.HttpServletRequest;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final BackendHealthMonitor healthMonitor;

  public GlobalExceptionHandler(BackendHealthMonitor healthMonitor) {
    this.healthMonitor = healthMonitor;
  }

  @ExceptionHandler(BackendUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleBackendUnavailable(
      BackendUnavailableException ex, HttpServletRequest request) {
    log.warn(
        "Backend unavailable: path={}, method={}, store={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getStore().key());
    healthMonitor.reportUnavailable(ex.getStore());
    var problem = ex.getBody();
    problem.setProperty("health", HealthResponse.from(healthMonitor.snapshot()));
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  @ExceptionHandler({DataAccessException.class, CannotCreateTransactionException.class})
  public ResponseEntity<ProblemDetail> handleDataAccess(
      RuntimeException ex, HttpServletRequest request) {
    if (!RelationalStoreAdapter.isConnectivityFailure(ex)) {
      log.error("Data access failure: path={}", request.getRequestURI(), ex);
      var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
      problem.setTitle("Data access failure");
      problem.setDetail("The request could not be completed");
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
    return handleBackendUnavailable(
        new BackendUnavailableException(
            StoreKind.RELATIONAL, "Relational store unavailable: " + ex.getMessage(), ex),
        request);
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var conflict =
        new VersionConflictException("Resource was modified concurrently. Re-read and retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(conflict.getBody());
  }

  @ExceptionHandler(MemberContextNotBoundException.class)
  public ResponseEntity<ProblemDetail> handleMemberContextNotBound(
      MemberContextNotBoundException ex) {
    log.debug("Request without member identity: {}", ex.getMessage());
    var problem =
        new InvalidRequestException("Member identity required", ex.getMessage()).getBody();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
    var problem = new InvalidRequestException("Validation failed", detail).getBody();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }

  @Override
  protected ResponseEntity<Object> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var cause = ex.getMostSpecificCause();
    var detail =
        cause instanceof IllegalArgumentException
            ? cause.getMessage()
            : "Request body could not be parsed";
    log.debug("Unreadable request body: {}", ex.getMessage());
    var problem = new InvalidRequestException("Malformed request", detail).getBody();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }

  @Override
  protected ResponseEntity<Object> handleTypeMismatch(
      TypeMismatchException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request) {
    var detail = "Invalid value '" + ex.getValue() + "' for " + ex.getPropertyName();
    var problem = new InvalidRequestException("Invalid parameter", detail).getBody();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }
}
