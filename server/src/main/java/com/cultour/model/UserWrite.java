package com.cultour.model;

import com.cultour.validation.Rules;
import com.cultour.validation.Schema;

/**
 * Creation or update payload for a directory user. Fields left null on update keep their
 * stored value.
 *
 * @param email login e-mail, unique in the directory
 * @param password plain-text password, only sent to the directory
 * @param phone optional phone number
 * @param role one of {@link #ROLE_USER}, {@link #ROLE_ADMIN}, {@link #ROLE_MODERATOR}
 */
public record UserWrite(String email, String password, String phone, String role) {

  public static final String ROLE_USER = "user";
  public static final String ROLE_ADMIN = "admin";
  public static final String ROLE_MODERATOR = "moderator";

  public static final Schema<UserWrite> CREATE_SCHEMA =
      Schema.<UserWrite>builder()
          .field("email", UserWrite::email, Rules.required(), Rules.email(), Rules.max(255))
          .field("password", UserWrite::password, Rules.required(), Rules.password())
          .field("phone", UserWrite::phone, Rules.max(20))
          .field("role", UserWrite::role, Rules.oneOf(ROLE_USER, ROLE_ADMIN, ROLE_MODERATOR))
          .build();

  public static final Schema<UserWrite> UPDATE_SCHEMA =
      Schema.<UserWrite>builder()
          .field("email", UserWrite::email, Rules.email(), Rules.max(255))
          .field("password", UserWrite::password, Rules.password())
          .field("phone", UserWrite::phone, Rules.max(20))
          .field("role", UserWrite::role, Rules.oneOf(ROLE_USER, ROLE_ADMIN, ROLE_MODERATOR))
          .build();

  /** Returns a copy with the role filled in when the caller left it empty. */
  public UserWrite withDefaultRole() {
    if (role != null && !role.isEmpty()) {
      return this;
    }
    return new UserWrite(email, password, phone, ROLE_USER);
  }

  @Override
  public String toString() {
    return "UserWrite{email=" + email + ", phone=" + phone + ", role=" + role + "}";
  }
}
