package com.cultour.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class PaginationTest {

  @Test
  void derivesTotalPagesAndNextPage() {
    Pagination first = Pagination.of(25, 1, 10);
    assertEquals(3, first.totalPages());
    assertTrue(first.hasNextPage());

    Pagination last = Pagination.of(25, 3, 10);
    assertFalse(last.hasNextPage());

    Pagination exact = Pagination.of(20, 2, 10);
    assertEquals(2, exact.totalPages());
    assertFalse(exact.hasNextPage());
  }

  @Test
  void emptyResultHasNoPages() {
    Pagination empty = Pagination.of(0, 1, 10);
    assertEquals(0, empty.totalPages());
    assertFalse(empty.hasNextPage());
  }

  @Test
  void windowCutsRequestedPage() {
    List<Integer> all = List.of(1, 2, 3, 4, 5);

    Page<Integer> second = Page.window(all, 2, 2);
    assertEquals(List.of(3, 4), second.items());
    assertEquals(5, second.pagination().total());
    assertTrue(second.pagination().hasNextPage());

    Page<Integer> last = Page.window(all, 3, 2);
    assertEquals(List.of(5), last.items());

    Page<Integer> beyond = Page.window(all, 9, 2);
    assertTrue(beyond.items().isEmpty());
    assertEquals(5, beyond.pagination().total());
  }

  @Test
  void pageOfSearchResultUsesOptionsWindow() {
    ListOptions options =
        ListOptions.builder()
            .page(2)
            .perPage(3)
            .build()
            .normalize(QueryDefaults.standard())
            .getValue();

    Page<String> page = Page.of(new SearchResult<>(List.of("d", "e", "f"), 7), options);

    assertEquals(List.of("d", "e", "f"), page.items());
    assertEquals(new Pagination(7, 2, 3, 3, true), page.pagination());
  }
}
