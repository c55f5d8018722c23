package com.codeheadsystems.gatekeeper.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.gatekeeper.server.model.RecordMetadata;
import com.codeheadsystems.gatekeeper.server.model.Session;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.InMemorySessionStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BearerTokenGateTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private SessionManager sessionManager;

  private BearerTokenGate gate;

  @BeforeEach
  void setUp() {
    gate = new BearerTokenGate(sessionManager);
  }

  @Test
  void evaluate_missingHeader_isAuthHeaderRequired() {
    assertThat(gate.evaluate(null).reason()).isEqualTo(RejectReason.AUTH_HEADER_REQUIRED);
    assertThat(gate.evaluate("").reason()).isEqualTo(RejectReason.AUTH_HEADER_REQUIRED);
    verifyNoInteractions(sessionManager);
  }

  @Test
  void evaluate_otherScheme_isSchemeMismatch() {
    assertThat(gate.evaluate("Basic dXNlcjpwYXNz").reason()).isEqualTo(RejectReason.SCHEME_MISMATCH);
    assertThat(gate.evaluate("bearer abc").reason()).isEqualTo(RejectReason.SCHEME_MISMATCH);
    assertThat(gate.evaluate("Bearer").reason()).isEqualTo(RejectReason.SCHEME_MISMATCH);
    assertThat(gate.evaluate("Token abc").reason()).isEqualTo(RejectReason.SCHEME_MISMATCH);
    verifyNoInteractions(sessionManager);
  }

  @Test
  void evaluate_emptyCredential_isCredentialRequired() {
    GateDecision decision = gate.evaluate("Bearer ");

    assertThat(decision.admitted()).isFalse();
    assertThat(decision.reason()).isEqualTo(RejectReason.CREDENTIAL_REQUIRED);
    verifyNoInteractions(sessionManager);
  }

  @Test
  void evaluate_expiredToken_isTokenExpired() {
    when(sessionManager.decodeAndValidate("abc")).thenReturn(TokenVerification.expired());

    assertThat(gate.evaluate("Bearer abc").reason()).isEqualTo(RejectReason.TOKEN_EXPIRED);
  }

  @Test
  void evaluate_invalidToken_isTokenInvalid() {
    when(sessionManager.decodeAndValidate("abc")).thenReturn(TokenVerification.invalid());

    assertThat(gate.evaluate("Bearer abc").reason()).isEqualTo(RejectReason.TOKEN_INVALID);
  }

  @Test
  void evaluate_validToken_admitsUser() {
    TokenClaims claims = new TokenClaims(123L, "jti-1", NOW, NOW, NOW.plusSeconds(60));
    when(sessionManager.decodeAndValidate("abc")).thenReturn(TokenVerification.valid(claims));

    GateDecision decision = gate.evaluate("Bearer abc");

    assertThat(decision.admitted()).isTrue();
    assertThat(decision.reason()).isNull();
    assertThat(decision.user()).isEqualTo(new AuthenticatedUser(123L, "jti-1"));
    assertThat(decision.claims()).isEqualTo(claims);
  }

  @Test
  void evaluate_issuedSession_admitsItsUser() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    SessionManager real = new SessionManager(SigningSecret.fromString("gate-test-secret"),
        SessionPolicy.defaults(), new InMemorySessionStore(clock), clock);
    Session session = real.issue(new User(RecordMetadata.created(123L, NOW), "u@example.com", "h"),
        null, null);

    GateDecision decision = new BearerTokenGate(real).evaluate("Bearer " + session.token());

    assertThat(decision.admitted()).isTrue();
    assertThat(AuthenticatedUser.userIdOf(decision.user())).isEqualTo(123L);
  }

  @Test
  void rejectReasons_carryClientMessages() {
    assertThat(RejectReason.AUTH_HEADER_REQUIRED.message()).isEqualTo("Authorization header is required");
    assertThat(RejectReason.SCHEME_MISMATCH.message())
        .isEqualTo("Authorization header must start with 'Bearer'");
    assertThat(RejectReason.CREDENTIAL_REQUIRED.message()).isEqualTo("Token is required");
    assertThat(RejectReason.TOKEN_EXPIRED.message()).isEqualTo("Token has expired");
    assertThat(RejectReason.TOKEN_INVALID.message()).isEqualTo("Invalid token");
  }
}
