package com.cultour.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored achievement badge.
 *
 * @param id badge identifier
 * @param name unique name
 * @param description description, possibly null
 * @param iconUrl icon URL, possibly null
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
public record BadgeDto(
    UUID id,
    String name,
    String description,
    String iconUrl,
    Instant createdAt,
    Instant updatedAt) {}
