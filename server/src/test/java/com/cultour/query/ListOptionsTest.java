package com.cultour.query;

import static org.junit.jupiter.api.Assertions.*;

import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import org.junit.jupiter.api.Test;

class ListOptionsTest {

  private static final QueryDefaults DEFAULTS = new QueryDefaults(10, 50, "created_at");

  @Test
  void normalizeClampsPageWindow() {
    // Given a page below 1 and a page size above the maximum
    ListOptions options = ListOptions.builder().page(-3).perPage(500).build();

    // When
    ListOptions normalized = options.normalize(DEFAULTS).getValue();

    // Then
    assertEquals(1, normalized.page());
    assertEquals(50, normalized.perPage());
    assertEquals(0, normalized.offset());
  }

  @Test
  void normalizeFillsDefaults() {
    ListOptions normalized = ListOptions.firstPage().normalize(DEFAULTS).getValue();

    assertEquals(10, normalized.perPage());
    assertEquals("created_at", normalized.sortBy());
    assertEquals(SortOrder.DESCENDING, normalized.sortDirection());
    assertEquals("", normalized.search());
    assertFalse(normalized.hasSearch());
  }

  @Test
  void normalizeKeepsExplicitValues() {
    ListOptions normalized =
        ListOptions.builder()
            .page(3)
            .perPage(20)
            .sortBy(" name ")
            .sortOrder("asc")
            .search(" batik ")
            .build()
            .normalize(DEFAULTS)
            .getValue();

    assertEquals(3, normalized.page());
    assertEquals(20, normalized.perPage());
    assertEquals(40, normalized.offset());
    assertEquals("name", normalized.sortBy());
    assertEquals(SortOrder.ASCENDING, normalized.sortDirection());
    assertEquals("batik", normalized.search());
  }

  @Test
  void invalidSortOrderIsRejected() {
    StatusOr<ListOptions> result =
        ListOptions.builder().sortOrder("sideways").build().normalize(DEFAULTS);

    assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode());
    assertTrue(result.getStatus().getMessage().contains("sideways"));
  }

  @Test
  void filterWithEmptyFieldOrOperatorFailsValidation() {
    ListOptions emptyField =
        ListOptions.builder()
            .filter(new FilterOption("", FilterOperator.EQUAL, FilterValue.ofString("x")))
            .build();
    ListOptions missingOperator =
        ListOptions.builder()
            .filter(new FilterOption("email", null, FilterValue.ofString("x")))
            .build();

    assertEquals(StatusCode.INVALID_ARGUMENT, emptyField.validate().getCode());
    assertTrue(emptyField.validate().getMessage().contains("field is required"));
    assertEquals(StatusCode.INVALID_ARGUMENT, missingOperator.validate().getCode());
    assertTrue(missingOperator.validate().getMessage().contains("operator is required"));
  }

  @Test
  void listOperatorsNeedListValues() {
    ListOptions options =
        ListOptions.builder()
            .filter(new FilterOption("role", FilterOperator.IN, FilterValue.ofString("admin")))
            .filter(
                new FilterOption(
                    "role", FilterOperator.EQUAL, FilterValue.ofStrings(java.util.List.of("a"))))
            .build();

    String message = options.validate().getMessage();
    assertTrue(message.contains("operator in needs a list value"), message);
    assertTrue(message.contains("operator eq needs a single value"), message);
  }

  @Test
  void filtersAreImmutable() {
    ListOptions options = ListOptions.builder().filter(FilterOption.equal("role", "user")).build();
    assertThrows(
        UnsupportedOperationException.class,
        () -> options.filters().add(FilterOption.equal("role", "admin")));
  }
}
