package com.cultour.repository.directory;

import com.cultour.config.DirectoryConfig;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.tinylog.Logger;

/**
 * {@link DirectoryClient} for a GoTrue-compatible auth server, speaking to its admin endpoints
 * under {@code /auth/v1/admin/users} with the service key.
 */
public class GoTrueDirectoryClient implements DirectoryClient {

  private static final String USERS_PATH = "/auth/v1/admin/users";
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final HttpClient httpClient;
  private final Gson gson;
  private final String baseUrl;
  private final String serviceKey;

  public GoTrueDirectoryClient(DirectoryConfig config, HttpClient httpClient, Gson gson) {
    this.baseUrl = stripTrailingSlash(config.url());
    this.serviceKey = config.serviceKey();
    this.httpClient = httpClient;
    this.gson = gson;
  }

  public GoTrueDirectoryClient(DirectoryConfig config) {
    this(
        config,
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
        new Gson());
  }

  @Override
  public DirectoryUser createUser(DirectoryUserRequest request) throws DirectoryException {
    HttpRequest httpRequest =
        newRequest(USERS_PATH)
            .POST(HttpRequest.BodyPublishers.ofString(gson.toJson(request)))
            .build();
    return parse(send(httpRequest, "create user"), DirectoryUser.class);
  }

  @Override
  public DirectoryUser getUser(UUID id) throws DirectoryException {
    HttpRequest httpRequest = newRequest(USERS_PATH + "/" + id).GET().build();
    return parse(send(httpRequest, "get user"), DirectoryUser.class);
  }

  @Override
  public DirectoryUser updateUser(UUID id, DirectoryUserRequest request)
      throws DirectoryException {
    HttpRequest httpRequest =
        newRequest(USERS_PATH + "/" + id)
            .PUT(HttpRequest.BodyPublishers.ofString(gson.toJson(request)))
            .build();
    return parse(send(httpRequest, "update user"), DirectoryUser.class);
  }

  @Override
  public void deleteUser(UUID id) throws DirectoryException {
    send(newRequest(USERS_PATH + "/" + id).DELETE().build(), "delete user");
  }

  @Override
  public DirectoryPage listUsers(int page, int perPage) throws DirectoryException {
    String path = String.format("%s?page=%d&per_page=%d", USERS_PATH, page, perPage);
    HttpResponse<String> response = send(newRequest(path).GET().build(), "list users");
    ListUsersResponse body = parse(response, ListUsersResponse.class);
    return new DirectoryPage(body == null ? null : body.users());
  }

  private HttpRequest.Builder newRequest(String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .timeout(REQUEST_TIMEOUT)
        .header("apikey", serviceKey)
        .header("Authorization", "Bearer " + serviceKey)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json");
  }

  private HttpResponse<String> send(HttpRequest request, String operation)
      throws DirectoryException {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DirectoryException("directory " + operation + " interrupted", e);
    } catch (IOException e) {
      throw new DirectoryException("directory " + operation + " failed: " + e.getMessage(), e);
    }

    int code = response.statusCode();
    if (code < 200 || code >= 300) {
      Logger.debug("Directory {} returned HTTP {}: {}", operation, code, response.body());
      throw new DirectoryException(code, "directory " + operation + " returned HTTP " + code);
    }
    return response;
  }

  private <T> T parse(HttpResponse<String> response, Class<T> type) throws DirectoryException {
    try {
      return gson.fromJson(response.body(), type);
    } catch (JsonParseException e) {
      throw new DirectoryException("unreadable directory response: " + e.getMessage(), e);
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  record ListUsersResponse(List<DirectoryUser> users) {}
}
