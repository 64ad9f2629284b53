package io.b2mash.opsdesk.exception;

/** Client-visible error categories, exposed as the {@code kind} property of problem responses. */
public enum ErrorKind {
  NOT_FOUND("NotFound"),
  ILLEGAL_TRANSITION("IllegalTransition"),
  VERSION_CONFLICT("VersionConflict"),
  BACKEND_UNAVAILABLE("BackendUnavailable"),
  VALIDATION_ERROR("ValidationError");

  public static final String PROPERTY = "kind";

  private final String label;

  ErrorKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
