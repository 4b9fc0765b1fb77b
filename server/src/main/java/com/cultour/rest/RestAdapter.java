package com.cultour.rest;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.db.util.UuidUtil;
import com.cultour.query.Page;
import com.cultour.rest.dto.ApiResponse;
import com.cultour.rest.dto.ErrorResponse;
import com.google.gson.JsonParseException;
import io.javalin.http.Context;
import java.util.List;
import java.util.UUID;
import org.tinylog.Logger;

/**
 * Shared behavior of the REST adapters: path parameter parsing and the response envelopes.
 *
 * <p>Errors are sent with the HTTP status of their {@link com.cultour.common.status.StatusCode}.
 * Client errors carry the status message. Server errors carry a generic message; the cause is
 * logged instead.
 */
public interface RestAdapter {

  /** Sends {@code status} as an {@link ErrorResponse}. */
  default void setError(Context ctx, Status status) {
    int httpCode = status.getHttpCode();
    String message = status.getMessage();
    if (httpCode >= 500) {
      Logger.error(status.getCause(), "Request {} {} failed: {}", ctx.method(), ctx.path(), status);
      message = "the service is temporarily unable to complete the request";
    } else {
      Logger.info("Request {} {} rejected: {}", ctx.method(), ctx.path(), status);
    }
    ctx.status(httpCode).json(new ErrorResponse(false, message, status.getCode().name()));
  }

  /** Parses the identifier in path parameter {@code name}. */
  default StatusOr<UUID> pathId(Context ctx, String name) {
    StatusOr<UUID> idOr = UuidUtil.fromString(ctx.pathParam(name));
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus().withContext("path parameter " + name));
    }
    return idOr;
  }

  /** Reads the JSON body. A missing or malformed body is INVALID_ARGUMENT. */
  default <T> StatusOr<T> body(Context ctx, Class<T> type) {
    T value;
    try {
      value = ctx.bodyAsClass(type);
    } catch (JsonParseException e) {
      return StatusOr.ofStatus(Status.invalidArgument("malformed JSON body: " + e.getMessage()));
    }
    if (value == null) {
      return StatusOr.ofStatus(Status.invalidArgument("request body is required"));
    }
    return StatusOr.ofValue(value);
  }

  /** Sends {@code result}'s value in the success envelope, or its error. */
  default <T> void respond(Context ctx, int httpCode, String message, StatusOr<T> result) {
    if (result.isNotOk()) {
      setError(ctx, result.getStatus());
      return;
    }
    ctx.status(httpCode).json(ApiResponse.of(message, result.getValue()));
  }

  /** Sends a page of items with its pagination metadata, or the error. */
  default <T> void respondPage(Context ctx, String message, StatusOr<Page<T>> result) {
    if (result.isNotOk()) {
      setError(ctx, result.getStatus());
      return;
    }
    Page<T> page = result.getValue();
    List<T> items = page.items();
    ctx.status(200).json(ApiResponse.paged(message, items, page.pagination()));
  }

  /** Sends an empty success envelope, or the error. */
  default void respondStatus(Context ctx, String message, Status status) {
    if (status.isError()) {
      setError(ctx, status);
      return;
    }
    ctx.status(200).json(ApiResponse.of(message, null));
  }
}
