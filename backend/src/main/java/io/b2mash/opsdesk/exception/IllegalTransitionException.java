package io.b2mash.opsdesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when a lifecycle event is not legal for the entity's current status. */
public class IllegalTransitionException extends ErrorResponseException {

  private final String currentStatus;
  private final String event;

  public IllegalTransitionException(String entityType, Object currentStatus, String event) {
    this(
        entityType,
        currentStatus,
        event,
        "Cannot " + event + " " + entityType.toLowerCase() + " in status " + currentStatus);
  }

  public IllegalTransitionException(
      String entityType, Object currentStatus, String event, String detail) {
    super(HttpStatus.CONFLICT, createProblem(entityType, currentStatus, event, detail), null);
    this.currentStatus = String.valueOf(currentStatus);
    this.event = event;
  }

  public String getCurrentStatus() {
    return currentStatus;
  }

  public String getEvent() {
    return event;
  }

  private static ProblemDetail createProblem(
      String entityType, Object currentStatus, String event, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Illegal " + entityType.toLowerCase() + " transition");
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.ILLEGAL_TRANSITION.label());
    problem.setProperty("currentStatus", String.valueOf(currentStatus));
    problem.setProperty("event", event);
    return problem;
  }
}
