package com.cultour.repository.directory;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.cultour.config.DirectoryConfig;
import com.cultour.model.UserWrite;
import com.google.gson.Gson;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class GoTrueDirectoryClientTest {

  private static final String USER_JSON =
      """
      {"id": "7c9e6679-7425-40de-944b-e07fc1f90ae7", "email": "ana@cultour.id",
       "phone": "", "role": "user", "last_sign_in_at": null,
       "created_at": "2024-03-01T08:00:00Z", "updated_at": "2024-03-02T08:00:00Z"}
      """;

  private HttpClient httpClient;
  private HttpResponse<String> response;
  private GoTrueDirectoryClient client;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    httpClient = mock(HttpClient.class);
    response = mock(HttpResponse.class);
    client =
        new GoTrueDirectoryClient(
            new DirectoryConfig("https://auth.cultour.test/", "service-key", 50),
            httpClient,
            new Gson());
  }

  @SuppressWarnings("unchecked")
  private void respondWith(int status, String body) throws Exception {
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenReturn(response);
  }

  @Test
  @SuppressWarnings("unchecked")
  void getUserSendsServiceKeyAndParsesUser() throws Exception {
    respondWith(200, USER_JSON);

    DirectoryUser user = client.getUser(UUID.fromString("7c9e6679-7425-40de-944b-e07fc1f90ae7"));

    assertEquals("ana@cultour.id", user.email());
    assertEquals("2024-03-01T08:00:00Z", user.createdAt());

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    HttpRequest request = captor.getValue();
    assertEquals(
        "https://auth.cultour.test/auth/v1/admin/users/7c9e6679-7425-40de-944b-e07fc1f90ae7",
        request.uri().toString());
    assertEquals("service-key", request.headers().firstValue("apikey").orElseThrow());
    assertEquals(
        "Bearer service-key", request.headers().firstValue("Authorization").orElseThrow());
  }

  @Test
  @SuppressWarnings("unchecked")
  void listUsersRequestsPageAndReadsUsers() throws Exception {
    respondWith(200, "{\"users\": [" + USER_JSON + "]}");

    DirectoryPage page = client.listUsers(2, 50);

    assertEquals(1, page.users().size());
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    assertEquals(
        "https://auth.cultour.test/auth/v1/admin/users?page=2&per_page=50",
        captor.getValue().uri().toString());
  }

  @Test
  void emptyListingHasNoUsers() throws Exception {
    respondWith(200, "{\"users\": []}");

    assertTrue(client.listUsers(1, 50).users().isEmpty());
  }

  @Test
  void errorStatusBecomesDirectoryException() throws Exception {
    respondWith(422, "{\"msg\": \"email exists\"}");

    DirectoryException e =
        assertThrows(
            DirectoryException.class,
            () ->
                client.createUser(
                    DirectoryUserRequest.forCreate(
                        new UserWrite("ana@cultour.id", "Str0ng!pass", null, "user"))));
    assertEquals(422, e.getHttpStatus());
  }

  @Test
  @SuppressWarnings("unchecked")
  void transportFailureHasNoHttpStatus() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new IOException("connection refused"));

    DirectoryException e =
        assertThrows(DirectoryException.class, () -> client.deleteUser(UUID.randomUUID()));
    assertEquals(0, e.getHttpStatus());
    assertInstanceOf(IOException.class, e.getCause());
  }
}
