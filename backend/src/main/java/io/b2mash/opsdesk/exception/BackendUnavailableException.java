package io.b2mash.opsdesk.exception;

import io.b2mash.opsdesk.store.StoreKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A backing store timed out or refused the connection. Adapters translate transport failures into
 * this exception; callers on the search and cache paths recover from it locally.
 */
public class BackendUnavailableException extends ErrorResponseException {

  private final StoreKind store;

  public BackendUnavailableException(StoreKind store, String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(store, detail), cause);
    this.store = store;
  }

  public BackendUnavailableException(StoreKind store, String detail) {
    this(store, detail, null);
  }

  public StoreKind getStore() {
    return store;
  }

  private static ProblemDetail createProblem(StoreKind store, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Backend unavailable");
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.BACKEND_UNAVAILABLE.label());
    problem.setProperty("store", store.key());
    return problem;
  }
}
