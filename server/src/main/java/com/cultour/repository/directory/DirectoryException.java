package com.cultour.repository.directory;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusCode;

/** A failed call to the user directory. */
public class DirectoryException extends Exception {

  /** HTTP status of the failed call, or 0 when no response arrived. */
  private final int httpStatus;

  public DirectoryException(int httpStatus, String message) {
    super(message);
    this.httpStatus = httpStatus;
  }

  public DirectoryException(String message, Throwable cause) {
    super(message, cause);
    this.httpStatus = 0;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  /**
   * Translates the failure: 404 is NOT_FOUND, 409 and 422 are ALREADY_EXISTS, any other 4xx is
   * INVALID_ARGUMENT, and 5xx or a missing response is UNAVAILABLE.
   */
  public Status toStatus(String context) {
    String message = context + ": " + getMessage();
    if (httpStatus == 0) {
      return Status.unavailable(message, getCause());
    }
    if (httpStatus == 422) {
      return Status.alreadyExists(message);
    }
    StatusCode code = StatusCode.fromHttpStatus(httpStatus);
    if (code == StatusCode.UNAVAILABLE) {
      return Status.unavailable(message, this);
    }
    return Status.of(code, message);
  }
}
