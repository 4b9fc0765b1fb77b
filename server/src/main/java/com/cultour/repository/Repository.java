package com.cultour.repository;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import com.cultour.query.ListOptions;
import com.cultour.query.SearchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nonnull;

/**
 * Uniform access to one kind of entity, whatever backend stores it.
 *
 * <p>Every method reports failures as one of the kinds in
 * {@link com.cultour.common.status.StatusCode}: INVALID_ARGUMENT for malformed options or
 * filters, NOT_FOUND for a missing id, ALREADY_EXISTS for a uniqueness violation and
 * UNAVAILABLE when the backend call itself fails.
 *
 * <p>Filters and sort fields use external field names (for example {@code user_id},
 * {@code created_at}). Each implementation accepts a fixed set of fields and rejects any other
 * with INVALID_ARGUMENT. Operator and field-type combinations it cannot evaluate are rejected
 * in the same way, never ignored.
 *
 * @param <W> the write model
 * @param <R> the read model
 */
public interface Repository<W, R> {

  /** Stores a new entity and returns it as read back from the backend. */
  @Nonnull
  StatusOr<R> create(W value);

  /** Returns the entity, or NOT_FOUND. */
  @Nonnull
  StatusOr<R> findById(UUID id);

  /** Overwrites the stored fields of an existing entity, or returns NOT_FOUND. */
  @Nonnull
  StatusOr<R> update(UUID id, W value);

  /** Deletes the entity, or returns NOT_FOUND when there is nothing to delete. */
  @Nonnull
  Status delete(UUID id);

  @Nonnull
  StatusOr<Boolean> exists(UUID id);

  /** Every entity whose {@code field} equals {@code value}. No match is an empty list. */
  @Nonnull
  StatusOr<List<R>> findByField(String field, FilterValue value);

  /** One page of entities matching the options' filters and search text. */
  @Nonnull
  StatusOr<List<R>> list(ListOptions options);

  /** Number of entities matching all {@code filters}. */
  @Nonnull
  StatusOr<Long> count(List<FilterOption> filters);

  /**
   * One page of matches plus the total match count. The total honours the filters and search
   * text but not the page window.
   */
  @Nonnull
  StatusOr<SearchResult<R>> search(ListOptions options);

  /**
   * Creates each value in order, stopping at the first failure. Elements created before the
   * failure stay stored; the error message names the failing index.
   */
  @Nonnull
  default StatusOr<List<R>> bulkCreate(List<W> values) {
    List<R> created = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      StatusOr<R> result = create(values.get(i));
      if (result.isNotOk()) {
        return StatusOr.ofStatus(bulkFailure("bulk create", i, result.getStatus()));
      }
      created.add(result.getValue());
    }
    return StatusOr.ofValue(created);
  }

  /** Updates each entity in order with the same stop-at-first-failure semantics. */
  @Nonnull
  default StatusOr<List<R>> bulkUpdate(List<Keyed<W>> updates) {
    List<R> updated = new ArrayList<>(updates.size());
    for (int i = 0; i < updates.size(); i++) {
      Keyed<W> update = updates.get(i);
      StatusOr<R> result = update(update.id(), update.value());
      if (result.isNotOk()) {
        return StatusOr.ofStatus(bulkFailure("bulk update", i, result.getStatus()));
      }
      updated.add(result.getValue());
    }
    return StatusOr.ofValue(updated);
  }

  /** Deletes each entity in order with the same stop-at-first-failure semantics. */
  @Nonnull
  default Status bulkDelete(List<UUID> ids) {
    for (int i = 0; i < ids.size(); i++) {
      Status status = delete(ids.get(i));
      if (status.isError()) {
        return bulkFailure("bulk delete", i, status);
      }
    }
    return Status.ok();
  }

  private static Status bulkFailure(String operation, int index, Status cause) {
    return cause.withContext(
        operation + " stopped at element " + index + " (" + index + " already applied)");
  }
}
