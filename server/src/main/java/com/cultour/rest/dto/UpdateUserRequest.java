package com.cultour.rest.dto;

import com.cultour.model.UserWrite;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;

/** Body of {@code PUT /v1/users/{id}}. Omitted or empty fields keep their stored value. */
@OpenApiDescription("Fields to change on a user. Omitted or empty fields are left unchanged.")
@OpenApiName("UpdateUserRequest")
public record UpdateUserRequest(
    @OpenApiDescription("New login e-mail address.")
    @OpenApiExample("sari.w@example.com")
    @OpenApiNullable
    String email,

    @OpenApiDescription("New password.")
    @OpenApiNullable
    String password,

    @OpenApiDescription("New phone number.")
    @OpenApiNullable
    String phone,

    @OpenApiDescription("New role: user, admin or moderator.")
    @OpenApiNullable
    String role
) {

  public UpdateUserRequest() {
    this(null, null, null, null);
  }

  public UserWrite toWrite() {
    return new UserWrite(email, password, phone, role);
  }
}
