/**
 * Entity payloads and read models.
 *
 * <p>Each entity has a write record (the validated creation or update payload, carrying a
 * {@link com.cultour.validation.Schema} for its rules) and a read record returned by the
 * repositories, which adds the generated identifier, timestamps and joined data. Read records
 * are immutable snapshots built fresh on every repository call.
 */
package com.cultour.model;
