/**
 * Request and response bodies of the Cultour REST API.
 *
 * <p>Every response is wrapped in an envelope: {@link com.cultour.rest.dto.ApiResponse} on
 * success and {@link com.cultour.rest.dto.ErrorResponse} on failure. Read models from
 * {@code com.cultour.model} are returned as the envelope's {@code data} unchanged.
 *
 * <p>Request records follow the {@code Create[Resource]Request} and
 * {@code Update[Resource]Request} naming. They carry OpenAPI annotations for the generated
 * documentation and a no-argument constructor for JSON deserialization. They do no validation
 * of their own; the services validate the write models built from them.
 */
package com.cultour.rest.dto;
