package com.cultour.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * The outcome of an operation: OK, or one of the error kinds in {@link StatusCode} with a
 * human-readable message and, optionally, the underlying cause.
 */
public class Status {
  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null);
  }

  public static Status of(StatusCode code, String message, Throwable cause) {
    return new Status(code, message, cause);
  }

  public static Status ok() {
    return new Status(StatusCode.OK, null, null);
  }

  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  public static Status alreadyExists(String message) {
    return new Status(StatusCode.ALREADY_EXISTS, message, null);
  }

  /** Creates a status for a failed call into a backend service. */
  public static Status unavailable(String message, Throwable cause) {
    return new Status(StatusCode.UNAVAILABLE, message, cause);
  }

  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause);
  }

  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  public boolean isError() {
    return code != StatusCode.OK;
  }

  public boolean isOk() {
    return code == StatusCode.OK;
  }

  /**
   * Returns a copy of this status whose message is prefixed with {@code context}. The code and
   * cause are kept, so callers can add where a failure happened without changing its kind.
   */
  @Nonnull
  public Status withContext(String context) {
    if (isOk()) {
      return this;
    }
    String combined = message == null ? context : context + ": " + message;
    return new Status(code, combined, cause);
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
