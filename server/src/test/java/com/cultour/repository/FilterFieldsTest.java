package com.cultour.repository;

import static org.junit.jupiter.api.Assertions.*;

import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.query.FilterOperator;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilterFieldsTest {

  private static final FilterFields FIELDS =
      FilterFields.builder()
          .field("id", FilterValue.Type.UUID)
          .field("name", FilterValue.Type.STRING)
          .field("created_at", FilterValue.Type.TIMESTAMP)
          .build();

  @Test
  void resolveConvertsValueToFieldType() {
    StatusOr<FilterOption> resolved =
        FIELDS.resolve(
            new FilterOption(
                "created_at",
                FilterOperator.GREATER_EQUAL,
                FilterValue.ofString("2024-01-01T00:00:00Z")));

    assertTrue(resolved.isOk());
    assertEquals(FilterValue.Type.TIMESTAMP, resolved.getValue().value().type());
    assertEquals(
        Instant.parse("2024-01-01T00:00:00Z"), resolved.getValue().value().asTimestamp());
  }

  @Test
  void unknownFieldIsRejected() {
    StatusOr<FilterOption> resolved = FIELDS.resolve(FilterOption.equal("password", "x"));

    assertEquals(StatusCode.INVALID_ARGUMENT, resolved.getStatus().getCode());
    assertTrue(resolved.getStatus().getMessage().contains("unknown filter field 'password'"));
    assertTrue(resolved.getStatus().getMessage().contains("id, name, created_at"));
  }

  @Test
  void textOperatorsNeedStringFields() {
    StatusOr<FilterOption> resolved =
        FIELDS.resolve(
            new FilterOption("created_at", FilterOperator.LIKE, FilterValue.ofString("2024")));

    assertEquals(StatusCode.INVALID_ARGUMENT, resolved.getStatus().getCode());
    assertTrue(resolved.getStatus().getMessage().contains("operator like is not supported"));
  }

  @Test
  void orderingOperatorsRejectUuidFields() {
    StatusOr<FilterOption> resolved =
        FIELDS.resolve(
            new FilterOption(
                "id",
                FilterOperator.GREATER_THAN,
                FilterValue.ofString("7c9e6679-7425-40de-944b-e07fc1f90ae7")));

    assertEquals(StatusCode.INVALID_ARGUMENT, resolved.getStatus().getCode());
  }

  @Test
  void resolveAllStopsAtFirstBadFilter() {
    StatusOr<List<FilterOption>> resolved =
        FIELDS.resolveAll(
            List.of(
                FilterOption.like("name", "batik"),
                FilterOption.equal("id", "not-a-uuid"),
                FilterOption.equal("nope", "x")));

    assertEquals(StatusCode.INVALID_ARGUMENT, resolved.getStatus().getCode());
    assertTrue(resolved.getStatus().getMessage().startsWith("filter on id"));
  }

  @Test
  void sortFieldMustBeWhitelisted() {
    assertTrue(FIELDS.checkSortField("name").isOk());
    assertEquals(StatusCode.INVALID_ARGUMENT, FIELDS.checkSortField("bio").getCode());
  }
}
