package com.cultour.model;

import java.util.UUID;

/**
 * The owning user embedded in a profile, joined from {@code users_view}.
 *
 * @param id user identifier
 * @param email login e-mail
 * @param role application role
 */
public record UserSummary(UUID id, String email, String role) {}
