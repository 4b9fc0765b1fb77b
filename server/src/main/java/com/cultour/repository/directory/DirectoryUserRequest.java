package com.cultour.repository.directory;

import com.cultour.model.UserWrite;
import com.google.gson.annotations.SerializedName;

/**
 * Body of the admin create and update calls. Null fields are left out of the JSON and so left
 * unchanged by an update.
 */
public record DirectoryUserRequest(
    String email,
    String password,
    String phone,
    String role,
    @SerializedName("email_confirm") Boolean emailConfirm) {

  static DirectoryUserRequest forCreate(UserWrite user) {
    return new DirectoryUserRequest(
        user.email(), user.password(), blankToNull(user.phone()), user.role(), Boolean.TRUE);
  }

  static DirectoryUserRequest forUpdate(UserWrite user) {
    return new DirectoryUserRequest(
        blankToNull(user.email()),
        blankToNull(user.password()),
        blankToNull(user.phone()),
        blankToNull(user.role()),
        null);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
