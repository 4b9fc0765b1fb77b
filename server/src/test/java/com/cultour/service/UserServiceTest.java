package com.cultour.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.model.UserDto;
import com.cultour.model.UserWrite;
import com.cultour.query.ListOptions;
import com.cultour.query.Page;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SearchResult;
import com.cultour.repository.UserRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class UserServiceTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private UserRepository users;
  private UserService service;

  @BeforeEach
  void setUp() {
    users = mock(UserRepository.class);
    service = new UserService(new UserService.Config(users, QueryDefaults.standard()));
  }

  private static UserDto user(UUID id, String email, String phone, String role) {
    return new UserDto(id, email, phone, role, null, NOW, NOW);
  }

  @Test
  void createUserDefaultsRoleAndChecksEmail() {
    // Given
    when(users.existsByEmail("ana@cultour.id")).thenReturn(StatusOr.ofValue(false));
    when(users.create(any()))
        .thenReturn(StatusOr.ofValue(user(UUID.randomUUID(), "ana@cultour.id", null, "user")));

    // When
    StatusOr<UserDto> created =
        service.createUser(new UserWrite("ana@cultour.id", "Str0ng!pass", null, null));

    // Then
    assertTrue(created.isOk());
    ArgumentCaptor<UserWrite> captor = ArgumentCaptor.forClass(UserWrite.class);
    verify(users).create(captor.capture());
    assertEquals(UserWrite.ROLE_USER, captor.getValue().role());
  }

  @Test
  void createUserWithTakenEmailConflicts() {
    when(users.existsByEmail("ana@cultour.id")).thenReturn(StatusOr.ofValue(true));

    StatusOr<UserDto> created =
        service.createUser(new UserWrite("ana@cultour.id", "Str0ng!pass", null, "user"));

    assertEquals(StatusCode.ALREADY_EXISTS, created.getStatus().getCode());
    verify(users, never()).create(any());
  }

  @Test
  void createUserRejectsInvalidPayloadBeforeTouchingDirectory() {
    StatusOr<UserDto> created = service.createUser(new UserWrite("nope", "weak", null, "root"));

    assertEquals(StatusCode.INVALID_ARGUMENT, created.getStatus().getCode());
    assertTrue(created.getStatus().getMessage().contains("email"));
    assertTrue(created.getStatus().getMessage().contains("password"));
    assertTrue(created.getStatus().getMessage().contains("role"));
    verifyNoInteractions(users);
  }

  @Test
  void updateUserMergesSetFields() {
    // Given a stored user with a phone number
    UUID id = UUID.randomUUID();
    when(users.findById(id))
        .thenReturn(StatusOr.ofValue(user(id, "ana@cultour.id", "0811", "user")));
    when(users.update(eq(id), any()))
        .thenReturn(StatusOr.ofValue(user(id, "ana@cultour.id", "0811", "admin")));

    // When only the role is sent
    StatusOr<UserDto> updated = service.updateUser(id, new UserWrite("", null, "", "admin"));

    // Then the blank fields keep their stored values
    assertTrue(updated.isOk());
    ArgumentCaptor<UserWrite> captor = ArgumentCaptor.forClass(UserWrite.class);
    verify(users).update(eq(id), captor.capture());
    assertEquals("ana@cultour.id", captor.getValue().email());
    assertEquals("0811", captor.getValue().phone());
    assertEquals("admin", captor.getValue().role());
    verify(users, never()).findByEmail(any());
  }

  @Test
  void updateUserToAnotherUsersEmailConflicts() {
    UUID id = UUID.randomUUID();
    when(users.findById(id))
        .thenReturn(StatusOr.ofValue(user(id, "ana@cultour.id", null, "user")));
    when(users.findByEmail("budi@cultour.id"))
        .thenReturn(
            StatusOr.ofValue(
                Optional.of(user(UUID.randomUUID(), "budi@cultour.id", null, "user"))));

    StatusOr<UserDto> updated =
        service.updateUser(id, new UserWrite("budi@cultour.id", null, null, null));

    assertEquals(StatusCode.ALREADY_EXISTS, updated.getStatus().getCode());
    verify(users, never()).update(any(), any());
  }

  @Test
  void getUserByEmailReportsMissingUser() {
    when(users.findByEmail("ghost@cultour.id")).thenReturn(StatusOr.ofValue(Optional.empty()));

    assertEquals(
        StatusCode.NOT_FOUND, service.getUserByEmail("ghost@cultour.id").getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, service.getUserByEmail(" ").getStatus().getCode());
  }

  @Test
  void listUsersWrapsSearchInPage() {
    UserDto ana = user(UUID.randomUUID(), "ana@cultour.id", null, "user");
    when(users.search(any())).thenReturn(StatusOr.ofValue(new SearchResult<>(List.of(ana), 11)));

    Page<UserDto> page = service.listUsers(ListOptions.builder().perPage(5).build()).getValue();

    assertEquals(List.of(ana), page.items());
    assertEquals(11, page.pagination().total());
    assertEquals(3, page.pagination().totalPages());
    assertTrue(page.pagination().hasNextPage());

    ArgumentCaptor<ListOptions> captor = ArgumentCaptor.forClass(ListOptions.class);
    verify(users).search(captor.capture());
    assertEquals("created_at", captor.getValue().sortBy());
  }
}
