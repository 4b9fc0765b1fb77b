package com.cultour.common.status;

/**
 * The error kinds every repository and service operation reports, each paired with the HTTP
 * status the REST layer answers with.
 */
public enum StatusCode {
  OK(200),
  /** Bad input shape or values, including malformed list options and filters. */
  INVALID_ARGUMENT(400),
  /** A missing entity or a missing referenced entity. */
  NOT_FOUND(404),
  /** A uniqueness violation or a duplicate badge grant. */
  ALREADY_EXISTS(409),
  /** The backing store, directory or blob service failed. Treated as transient. */
  UNAVAILABLE(503),
  /** An unexpected or unmapped failure. */
  INTERNAL(500);

  private final int httpCode;

  StatusCode(int httpCode) {
    this.httpCode = httpCode;
  }

  /** Returns the corresponding HTTP status code. */
  public int getHttpCode() {
    return httpCode;
  }

  /** Returns whether this code represents a successful operation. */
  public boolean isSuccess() {
    return this == OK;
  }

  /**
   * Maps an HTTP status code reported by a remote backend to the closest error kind.
   *
   * <p>Any other 4xx becomes {@link #INVALID_ARGUMENT}. Any 5xx, and anything unexpected,
   * becomes {@link #UNAVAILABLE} because the remote side failed rather than this process.
   *
   * @param httpStatusCode the HTTP status code to convert
   * @return the corresponding StatusCode
   */
  public static StatusCode fromHttpStatus(int httpStatusCode) {
    switch (httpStatusCode) {
      case 200:
      case 201:
      case 204:
        return OK;
      case 404:
        return NOT_FOUND;
      case 409:
        return ALREADY_EXISTS;
      default:
        if (httpStatusCode >= 400 && httpStatusCode < 500) {
          return INVALID_ARGUMENT;
        }
        return UNAVAILABLE;
    }
  }
}
