package com.cultour.repository;

import java.util.UUID;

/**
 * A write payload paired with the identifier of the entity it updates.
 *
 * @param id the entity to update
 * @param value the new field values
 * @param <W> the write model type
 */
public record Keyed<W>(UUID id, W value) {}
