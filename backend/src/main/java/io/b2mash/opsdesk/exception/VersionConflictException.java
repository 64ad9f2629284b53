package io.b2mash.opsdesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A concurrent mutation won the check-and-set. Always surfaced to the caller as retryable; the
 * server never retries on the caller's behalf.
 */
public class VersionConflictException extends ErrorResponseException {

  public VersionConflictException(String entityType, Object id, Long expected, Long actual) {
    super(
        HttpStatus.CONFLICT,
        createProblem(
            entityType
                + " "
                + id
                + " is at version "
                + actual
                + " but version "
                + expected
                + " was expected"),
        null);
  }

  public VersionConflictException(String detail) {
    super(HttpStatus.CONFLICT, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.VERSION_CONFLICT.label());
    problem.setProperty("retryable", true);
    return problem;
  }
}
