package com.codeheadsystems.gatekeeper.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.gatekeeper.client.exceptions.GatekeeperAccessorException;
import com.codeheadsystems.gatekeeper.client.model.ServerConnectionInfo;
import com.codeheadsystems.gatekeeper.client.model.ServerIdentifier;
import com.codeheadsystems.gatekeeper.model.auth.ErrorResponse;
import com.codeheadsystems.gatekeeper.model.auth.LoginRequest;
import com.codeheadsystems.gatekeeper.model.auth.LoginResponse;
import com.codeheadsystems.gatekeeper.model.auth.MessageResponse;
import com.codeheadsystems.gatekeeper.model.auth.RegisterRequest;
import com.codeheadsystems.gatekeeper.model.auth.RegisterResponse;
import com.codeheadsystems.gatekeeper.model.auth.UserResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GatekeeperAccessorTest {

  private static final ServerIdentifier SERVER_ID = new ServerIdentifier("test-server");
  private static final URI BASE_URI = URI.create("http://localhost:8080");

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;
  @Mock private ObjectMapper objectMapper;

  private GatekeeperAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new GatekeeperAccessor(httpClient, objectMapper,
        Map.of(SERVER_ID, new ServerConnectionInfo(BASE_URI)));
  }

  @Test
  @SuppressWarnings("unchecked")
  void register_success_returnsResponse() throws Exception {
    RegisterResponse expected = new RegisterResponse(
        new UserResponse(1L, "a@example.com", "2026-01-01T00:00:00Z", "2026-01-01T00:00:00Z"));
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(201);
    when(httpResponse.body()).thenReturn("{\"user\":{}}");
    when(objectMapper.readValue(eq("{\"user\":{}}"), eq(RegisterResponse.class))).thenReturn(expected);

    RegisterResponse result = accessor.register(SERVER_ID, new RegisterRequest("a@example.com", "secret1"));

    assertThat(result).isEqualTo(expected);
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    assertThat(captor.getValue().uri()).isEqualTo(URI.create("http://localhost:8080/auth/register"));
    assertThat(captor.getValue().method()).isEqualTo("POST");
    assertThat(captor.getValue().headers().firstValue("Authorization")).isEmpty();
  }

  @Test
  @SuppressWarnings("unchecked")
  void login_401_throwsSecurityExceptionWithServerMessage() throws Exception {
    String body = "{\"error\":\"Invalid email or password\"}";
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);
    when(httpResponse.body()).thenReturn(body);
    when(objectMapper.readValue(body, ErrorResponse.class))
        .thenReturn(new ErrorResponse("Invalid email or password"));

    assertThatThrownBy(() -> accessor.login(SERVER_ID, new LoginRequest("a@example.com", "wrong1")))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Invalid email or password");
  }

  @Test
  @SuppressWarnings("unchecked")
  void login_401WithoutBody_throwsSecurityException() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);
    when(httpResponse.body()).thenReturn("");

    assertThatThrownBy(() -> accessor.login(SERVER_ID, new LoginRequest("a@example.com", "wrong1")))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("401");
  }

  @Test
  @SuppressWarnings("unchecked")
  void register_409_throwsAccessorExceptionWithStatus() throws Exception {
    String body = "{\"error\":\"Email already registered\"}";
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(409);
    when(httpResponse.body()).thenReturn(body);
    when(objectMapper.readValue(body, ErrorResponse.class))
        .thenReturn(new ErrorResponse("Email already registered"));

    assertThatThrownBy(() -> accessor.register(SERVER_ID, new RegisterRequest("a@example.com", "secret1")))
        .isInstanceOf(GatekeeperAccessorException.class)
        .hasMessageContaining("409")
        .hasMessageContaining("Email already registered")
        .extracting(e -> ((GatekeeperAccessorException) e).getStatusCode())
        .isEqualTo(409);
  }

  @Test
  @SuppressWarnings("unchecked")
  void register_ioException_throwsAccessorException() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> accessor.register(SERVER_ID, new RegisterRequest("a@example.com", "secret1")))
        .isInstanceOf(GatekeeperAccessorException.class)
        .hasMessageContaining("test-server")
        .hasCauseInstanceOf(IOException.class)
        .extracting(e -> ((GatekeeperAccessorException) e).getStatusCode())
        .isEqualTo(GatekeeperAccessorException.NO_STATUS);
  }

  @Test
  @SuppressWarnings("unchecked")
  void logout_sendsBearerToken() throws Exception {
    MessageResponse expected = new MessageResponse("Successfully logged out");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{}");
    when(objectMapper.readValue("{}", MessageResponse.class)).thenReturn(expected);

    MessageResponse result = accessor.logout(SERVER_ID, "abc.def.ghi");

    assertThat(result).isEqualTo(expected);
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    assertThat(captor.getValue().uri()).isEqualTo(URI.create("http://localhost:8080/auth/logout"));
    assertThat(captor.getValue().headers().firstValue("Authorization")).contains("Bearer abc.def.ghi");
  }

  @Test
  void unknownServer_throwsIllegalArgument() {
    assertThatThrownBy(() -> accessor.logout(new ServerIdentifier("nope"), "t"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("nope");
  }
}
