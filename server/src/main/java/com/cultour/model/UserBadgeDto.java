package com.cultour.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A badge grant: the one-time association of a user with a badge.
 *
 * @param id grant identifier
 * @param userId the holder
 * @param badgeId the badge
 * @param createdAt when the badge was granted
 * @param badge the granted badge, joined from {@code badges}
 */
public record UserBadgeDto(UUID id, UUID userId, UUID badgeId, Instant createdAt, BadgeDto badge) {}
