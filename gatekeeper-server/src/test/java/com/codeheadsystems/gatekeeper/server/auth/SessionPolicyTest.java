package com.codeheadsystems.gatekeeper.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SessionPolicyTest {

  @Test
  void defaults_dayLongRevocableSessions() {
    SessionPolicy policy = SessionPolicy.defaults();

    assertThat(policy.issuer()).isEqualTo(SessionPolicy.DEFAULT_ISSUER);
    assertThat(policy.ttl()).isEqualTo(Duration.ofHours(24));
    assertThat(policy.requireActiveSession()).isTrue();
  }

  @Test
  void constructor_maxTtl_accepted() {
    assertThat(new SessionPolicy("iss", SessionPolicy.MAX_TTL, true).ttl())
        .isEqualTo(SessionPolicy.MAX_TTL);
  }

  @Test
  void constructor_ttlBeyondMax_throwsIAE() {
    Duration tooLong = SessionPolicy.MAX_TTL.plusSeconds(1);

    assertThatThrownBy(() -> new SessionPolicy("iss", tooLong, true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must not exceed");
  }

  @Test
  void constructor_nonPositiveTtl_throwsIAE() {
    assertThatThrownBy(() -> new SessionPolicy("iss", Duration.ZERO, true))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_blankIssuer_throwsIAE() {
    assertThatThrownBy(() -> new SessionPolicy(" ", Duration.ofMinutes(1), true))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
