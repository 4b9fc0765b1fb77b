package com.cultour.rest.dto;

import com.cultour.query.Pagination;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;

/**
 * Success envelope of every endpoint.
 *
 * @param <T> type of the payload
 */
@OpenApiDescription("Envelope wrapping every successful response.")
@OpenApiName("ApiResponse")
public record ApiResponse<T>(
    @OpenApiDescription("Always true for successful responses.")
    boolean success,

    @OpenApiDescription("Human-readable summary of the outcome.")
    String message,

    @OpenApiDescription("The payload: a resource, a list of resources, or a count.")
    @OpenApiNullable
    T data,

    @OpenApiDescription("Page metadata, present on paginated list responses only.")
    @OpenApiNullable
    Pagination pagination
) {

  public static <T> ApiResponse<T> of(String message, T data) {
    return new ApiResponse<>(true, message, data, null);
  }

  public static <T> ApiResponse<T> paged(String message, T data, Pagination pagination) {
    return new ApiResponse<>(true, message, data, pagination);
  }
}
