package com.codeheadsystems.gatekeeper.client.accessor;

import com.codeheadsystems.gatekeeper.client.exceptions.GatekeeperAccessorException;
import com.codeheadsystems.gatekeeper.client.model.ServerConnectionInfo;
import com.codeheadsystems.gatekeeper.client.model.ServerIdentifier;
import com.codeheadsystems.gatekeeper.model.auth.ErrorResponse;
import com.codeheadsystems.gatekeeper.model.auth.LoginRequest;
import com.codeheadsystems.gatekeeper.model.auth.LoginResponse;
import com.codeheadsystems.gatekeeper.model.auth.MessageResponse;
import com.codeheadsystems.gatekeeper.model.auth.RegisterRequest;
import com.codeheadsystems.gatekeeper.model.auth.RegisterResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the {@code /auth} endpoints exposed by {@code gatekeeper-server}.
 * <p>
 * The {@code endpoint} stored in {@link ServerConnectionInfo} is treated as the <em>base URL</em>
 * of the server (e.g. {@code http://host:8080}); path segments are appended per endpoint.
 * <p>
 * A 401 response is surfaced as a {@link SecurityException} carrying the server's error message,
 * so callers can tell an expired token from an invalid one. Other error statuses, I/O errors and
 * interruptions are wrapped in {@link GatekeeperAccessorException}.
 */
@Singleton
public class GatekeeperAccessor {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Map<ServerIdentifier, ServerConnectionInfo> serverConnections;

  /**
   * Instantiates a new Gatekeeper accessor.
   *
   * @param httpClient        the http client
   * @param objectMapper      the object mapper
   * @param serverConnections the server connections
   */
  @Inject
  public GatekeeperAccessor(final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final Map<ServerIdentifier, ServerConnectionInfo> serverConnections) {
    log.info("GatekeeperAccessor()");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.serverConnections = serverConnections;
  }

  /**
   * Creates an account.
   *
   * @param serverId the server id
   * @param request  the request
   * @return the created user
   */
  public RegisterResponse register(final ServerIdentifier serverId, final RegisterRequest request) {
    log.debug("register(serverId={})", serverId);
    return post(serverId, "/auth/register", request, null, RegisterResponse.class);
  }

  /**
   * Logs in and returns the new session, including its bearer token.
   *
   * @param serverId the server id
   * @param request  the request
   * @return the login response
   * @throws SecurityException if the credentials are rejected (HTTP 401)
   */
  public LoginResponse login(final ServerIdentifier serverId, final LoginRequest request) {
    log.debug("login(serverId={})", serverId);
    return post(serverId, "/auth/login", request, null, LoginResponse.class);
  }

  /**
   * Revokes every session of the user owning {@code bearerToken}.
   *
   * @param serverId    the server id
   * @param bearerToken the bearer token (without "Bearer " prefix)
   * @return the confirmation message
   * @throws SecurityException if the token is rejected (HTTP 401)
   */
  public MessageResponse logout(final ServerIdentifier serverId, final String bearerToken) {
    log.debug("logout(serverId={})", serverId);
    return post(serverId, "/auth/logout", null, bearerToken, MessageResponse.class);
  }

  private URI resolve(ServerIdentifier serverId, String path) {
    ServerConnectionInfo info = serverConnections.get(serverId);
    if (info == null) {
      throw new IllegalArgumentException("No connection info for server: " + serverId);
    }
    URI base = info.endpoint();
    return base.resolve(base.getPath() + path);
  }

  private <T> T post(ServerIdentifier serverId, String path, Object body, String bearerToken,
                     Class<T> responseType) {
    URI uri = resolve(serverId, path);
    try {
      HttpRequest.BodyPublisher publisher = body == null
          ? HttpRequest.BodyPublishers.noBody()
          : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(uri)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(publisher);
      if (bearerToken != null) {
        builder.header("Authorization", "Bearer " + bearerToken);
      }
      HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      checkStatus(serverId, response);
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new GatekeeperAccessorException("HTTP request failed for server: " + serverId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GatekeeperAccessorException("HTTP request interrupted for server: " + serverId, e);
    }
  }

  private void checkStatus(ServerIdentifier serverId, HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode < 400) {
      return;
    }
    String serverMessage = errorMessage(response.body());
    if (statusCode == 401) {
      throw new SecurityException(serverMessage != null
          ? serverMessage
          : "Server rejected request (401) for server: " + serverId);
    }
    throw new GatekeeperAccessorException("Server returned HTTP " + statusCode + " for server: "
        + serverId + (serverMessage != null ? ": " + serverMessage : ""), statusCode, null);
  }

  private String errorMessage(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      ErrorResponse error = objectMapper.readValue(body, ErrorResponse.class);
      return error == null ? null : error.error();
    } catch (IOException e) {
      log.debug("Error body is not an error response: {}", e.getMessage());
      return null;
    }
  }
}
