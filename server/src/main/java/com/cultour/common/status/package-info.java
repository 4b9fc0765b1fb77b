/**
 * Error handling shared by every layer.
 *
 * <p>{@link com.cultour.common.status.StatusCode} names the error kinds: validation
 * ({@code INVALID_ARGUMENT}), missing entity ({@code NOT_FOUND}), uniqueness or duplicate grant
 * ({@code ALREADY_EXISTS}), failed backend call ({@code UNAVAILABLE}) and unexpected failure
 * ({@code INTERNAL}). Backend adapters convert their native failures (SQL states, directory HTTP
 * codes, blob client exceptions) into exactly one of these before returning, and services only
 * add the NOT_FOUND and ALREADY_EXISTS outcomes they detect themselves.
 *
 * <p>Typical use:
 *
 * <pre>
 * StatusOr&lt;BadgeDto&gt; badgeOr = badges.findByName(name);
 * if (badgeOr.isNotOk()) {
 *   return StatusOr.ofStatus(badgeOr.getStatus());
 * }
 * </pre>
 */
package com.cultour.common.status;
