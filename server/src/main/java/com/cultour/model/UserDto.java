package com.cultour.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A user as held by the identity directory.
 *
 * @param id directory identifier
 * @param email login e-mail
 * @param phone phone number, possibly empty
 * @param role application role
 * @param lastSignInAt last successful sign-in, null if the user never signed in
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
public record UserDto(
    UUID id,
    String email,
    String phone,
    String role,
    Instant lastSignInAt,
    Instant createdAt,
    Instant updatedAt) {}
