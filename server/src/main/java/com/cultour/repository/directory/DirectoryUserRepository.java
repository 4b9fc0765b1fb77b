package com.cultour.repository.directory;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.model.UserDto;
import com.cultour.model.UserWrite;
import com.cultour.query.FilterOperator;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import com.cultour.query.ListOptions;
import com.cultour.query.Page;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SearchResult;
import com.cultour.query.SortOrder;
import com.cultour.repository.FilterFields;
import com.cultour.repository.UserRepository;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * {@link UserRepository} over the external user directory.
 *
 * <p>The directory lists users page by page without filtering or sorting, so every query scans
 * the whole listing and evaluates filters, search, ordering and the page window in memory.
 * Totals are the number of entries that matched during the scan. Entries whose sort keys tie
 * keep the order the directory returned them in. E-mail lookups ignore case.
 */
public class DirectoryUserRepository implements UserRepository {

  static final FilterFields FIELDS =
      FilterFields.builder()
          .field("id", FilterValue.Type.UUID)
          .field("email", FilterValue.Type.STRING)
          .field("phone", FilterValue.Type.STRING)
          .field("role", FilterValue.Type.STRING)
          .field("created_at", FilterValue.Type.TIMESTAMP)
          .field("updated_at", FilterValue.Type.TIMESTAMP)
          .field("last_sign_in_at", FilterValue.Type.TIMESTAMP)
          .build();

  private static final ImmutableMap<String, Function<UserDto, FilterValue>> ACCESSORS =
      ImmutableMap.<String, Function<UserDto, FilterValue>>builder()
          .put("id", u -> u.id() == null ? null : FilterValue.ofUuid(u.id()))
          .put("email", u -> u.email() == null ? null : FilterValue.ofString(u.email()))
          .put("phone", u -> u.phone() == null ? null : FilterValue.ofString(u.phone()))
          .put("role", u -> u.role() == null ? null : FilterValue.ofString(u.role()))
          .put(
              "created_at",
              u -> u.createdAt() == null ? null : FilterValue.ofTimestamp(u.createdAt()))
          .put(
              "updated_at",
              u -> u.updatedAt() == null ? null : FilterValue.ofTimestamp(u.updatedAt()))
          .put(
              "last_sign_in_at",
              u -> u.lastSignInAt() == null ? null : FilterValue.ofTimestamp(u.lastSignInAt()))
          .buildOrThrow();

  private final DirectoryClient client;
  private final QueryDefaults defaults;
  private final int scanPageSize;

  public DirectoryUserRepository(DirectoryClient client, QueryDefaults defaults, int scanPageSize) {
    Preconditions.checkArgument(scanPageSize > 0, "scanPageSize must be positive");
    this.client = client;
    this.defaults = defaults;
    this.scanPageSize = scanPageSize;
  }

  @Nonnull
  @Override
  public StatusOr<UserDto> create(UserWrite value) {
    try {
      return toDto(client.createUser(DirectoryUserRequest.forCreate(value)));
    } catch (DirectoryException e) {
      return StatusOr.ofStatus(e.toStatus("create user"));
    }
  }

  @Nonnull
  @Override
  public StatusOr<UserDto> findById(UUID id) {
    try {
      return toDto(client.getUser(id));
    } catch (DirectoryException e) {
      return StatusOr.ofStatus(e.toStatus("load user " + id));
    }
  }

  @Nonnull
  @Override
  public StatusOr<UserDto> update(UUID id, UserWrite value) {
    try {
      return toDto(client.updateUser(id, DirectoryUserRequest.forUpdate(value)));
    } catch (DirectoryException e) {
      return StatusOr.ofStatus(e.toStatus("update user " + id));
    }
  }

  @Nonnull
  @Override
  public Status delete(UUID id) {
    try {
      client.deleteUser(id);
      return Status.ok();
    } catch (DirectoryException e) {
      return e.toStatus("delete user " + id);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Boolean> exists(UUID id) {
    StatusOr<UserDto> userOr = findById(id);
    if (userOr.isOk()) {
      return StatusOr.ofValue(true);
    }
    if (userOr.getStatus().getCode() == StatusCode.NOT_FOUND) {
      return StatusOr.ofValue(false);
    }
    return StatusOr.ofStatus(userOr.getStatus());
  }

  @Nonnull
  @Override
  public StatusOr<List<UserDto>> findByField(String field, FilterValue value) {
    StatusOr<FilterOption> filterOr =
        FIELDS.resolve(new FilterOption(field, FilterOperator.EQUAL, value));
    if (filterOr.isNotOk()) {
      return StatusOr.ofStatus(filterOr.getStatus());
    }
    return scanMatching(List.of(filterOr.getValue()), null);
  }

  @Nonnull
  @Override
  public StatusOr<Optional<UserDto>> findByEmail(String email) {
    if (Strings.isNullOrEmpty(email)) {
      return StatusOr.ofStatus(Status.invalidArgument("email is required"));
    }
    String needle = email.toLowerCase(Locale.ROOT);
    return scanMatching(List.of(), null)
        .map(users -> users.stream().filter(u -> sameEmail(u, needle)).findFirst());
  }

  @Nonnull
  @Override
  public StatusOr<Boolean> existsByEmail(String email) {
    return findByEmail(email).map(Optional::isPresent);
  }

  @Nonnull
  @Override
  public StatusOr<List<UserDto>> list(ListOptions options) {
    return search(options).map(SearchResult::items);
  }

  @Nonnull
  @Override
  public StatusOr<Long> count(List<FilterOption> filters) {
    StatusOr<List<FilterOption>> resolvedOr = FIELDS.resolveAll(filters);
    if (resolvedOr.isNotOk()) {
      return StatusOr.ofStatus(resolvedOr.getStatus());
    }
    return scanMatching(resolvedOr.getValue(), null).map(users -> (long) users.size());
  }

  @Nonnull
  @Override
  public StatusOr<SearchResult<UserDto>> search(ListOptions options) {
    StatusOr<ListOptions> normalizedOr = options.normalize(defaults);
    if (normalizedOr.isNotOk()) {
      return StatusOr.ofStatus(normalizedOr.getStatus());
    }
    ListOptions normalized = normalizedOr.getValue();
    Status sortStatus = FIELDS.checkSortField(normalized.sortBy());
    if (sortStatus.isError()) {
      return StatusOr.ofStatus(sortStatus);
    }
    StatusOr<List<FilterOption>> resolvedOr = FIELDS.resolveAll(normalized.filters());
    if (resolvedOr.isNotOk()) {
      return StatusOr.ofStatus(resolvedOr.getStatus());
    }

    StatusOr<List<UserDto>> matchedOr =
        scanMatching(resolvedOr.getValue(), normalized.search());
    if (matchedOr.isNotOk()) {
      return StatusOr.ofStatus(matchedOr.getStatus());
    }
    List<UserDto> matched = new ArrayList<>(matchedOr.getValue());
    matched.sort(comparator(normalized.sortBy(), normalized.sortDirection()));

    Page<UserDto> page = Page.window(matched, normalized.page(), normalized.perPage());
    return StatusOr.ofValue(new SearchResult<>(page.items(), matched.size()));
  }

  /** Walks every directory page and keeps the users that pass all filters and the search. */
  private StatusOr<List<UserDto>> scanMatching(List<FilterOption> filters, String search) {
    List<UserDto> matched = new ArrayList<>();
    int page = 1;
    int scanned = 0;
    while (true) {
      DirectoryPage directoryPage;
      try {
        directoryPage = client.listUsers(page, scanPageSize);
      } catch (DirectoryException e) {
        return StatusOr.ofStatus(e.toStatus("list users page " + page));
      }
      for (DirectoryUser entry : directoryPage.users()) {
        StatusOr<UserDto> userOr = toDto(entry);
        if (userOr.isNotOk()) {
          return StatusOr.ofStatus(userOr.getStatus());
        }
        UserDto user = userOr.getValue();
        if (matchesAll(user, filters) && matchesSearch(user, search)) {
          matched.add(user);
        }
      }
      scanned += directoryPage.users().size();
      if (directoryPage.users().size() < scanPageSize) {
        break;
      }
      page++;
    }
    Logger.debug(
        "Directory scan read {} users over {} pages, {} matched", scanned, page, matched.size());
    return StatusOr.ofValue(matched);
  }

  static boolean matchesAll(UserDto user, List<FilterOption> filters) {
    for (FilterOption filter : filters) {
      if (!matches(ACCESSORS.get(filter.field()).apply(user), filter)) {
        return false;
      }
    }
    return true;
  }

  /** Evaluates one resolved filter. A missing field value matches no operator. */
  static boolean matches(FilterValue actual, FilterOption filter) {
    if (actual == null) {
      return false;
    }
    FilterValue expected = filter.value();
    return switch (filter.operator()) {
      case EQUAL -> actual.matches(expected);
      case NOT_EQUAL -> !actual.matches(expected);
      case GREATER_THAN -> actual.compareTo(expected) > 0;
      case LESS_THAN -> actual.compareTo(expected) < 0;
      case GREATER_EQUAL -> actual.compareTo(expected) >= 0;
      case LESS_EQUAL -> actual.compareTo(expected) <= 0;
      case IN -> expected.asList().stream().anyMatch(actual::matches);
      case NOT_IN -> expected.asList().stream().noneMatch(actual::matches);
      case LIKE -> actual.containsIgnoreCase(expected);
      case STARTS_WITH -> actual.startsWithIgnoreCase(expected);
      case ENDS_WITH -> actual.endsWithIgnoreCase(expected);
    };
  }

  private static boolean sameEmail(UserDto user, String lowerEmail) {
    return user.email() != null && user.email().toLowerCase(Locale.ROOT).equals(lowerEmail);
  }

  /** Free text matches the e-mail or the phone number, ignoring case. */
  static boolean matchesSearch(UserDto user, String search) {
    if (search == null || search.isEmpty()) {
      return true;
    }
    String needle = search.toLowerCase(Locale.ROOT);
    return containsLower(user.email(), needle) || containsLower(user.phone(), needle);
  }

  private static boolean containsLower(String haystack, String needle) {
    return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
  }

  /** Orders on one whitelisted field; users without a value sort last in both directions. */
  static Comparator<UserDto> comparator(String field, SortOrder direction) {
    Function<UserDto, FilterValue> accessor = ACCESSORS.get(field);
    Comparator<FilterValue> valueOrder =
        direction == SortOrder.DESCENDING
            ? Comparator.<FilterValue>naturalOrder().reversed()
            : Comparator.<FilterValue>naturalOrder();
    return Comparator.comparing(accessor, Comparator.nullsLast(valueOrder));
  }

  private static StatusOr<UserDto> toDto(DirectoryUser entry) {
    if (entry == null) {
      return StatusOr.ofStatus(Status.unavailable("directory returned an empty user", null));
    }
    try {
      return StatusOr.ofValue(entry.toDto());
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(
          Status.unavailable("directory returned a malformed user: " + e.getMessage(), e));
    }
  }
}
