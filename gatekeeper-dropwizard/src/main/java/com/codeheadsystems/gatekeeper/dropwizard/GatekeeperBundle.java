package com.codeheadsystems.gatekeeper.dropwizard;

import com.codeheadsystems.gatekeeper.dropwizard.health.TokenCodecHealthCheck;
import com.codeheadsystems.gatekeeper.server.auth.AuthenticatedUser;
import com.codeheadsystems.gatekeeper.server.auth.BearerAuthFilter;
import com.codeheadsystems.gatekeeper.server.auth.BearerTokenGate;
import com.codeheadsystems.gatekeeper.server.auth.SessionManager;
import com.codeheadsystems.gatekeeper.server.auth.SessionPolicy;
import com.codeheadsystems.gatekeeper.server.auth.SigningSecret;
import com.codeheadsystems.gatekeeper.server.auth.TokenCodec;
import com.codeheadsystems.gatekeeper.server.manager.CredentialManager;
import com.codeheadsystems.gatekeeper.server.password.BCryptPasswordHasher;
import com.codeheadsystems.gatekeeper.server.resource.AuthResource;
import com.codeheadsystems.gatekeeper.server.store.InMemorySessionStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryUserStore;
import com.codeheadsystems.gatekeeper.server.store.SessionStore;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires gatekeeper sessions into an existing Dropwizard application.
 * <p>
 * Registers the {@code /auth} JAX-RS resource, the token health check, and the bearer
 * authentication filter. Requires a {@link GatekeeperConfiguration} block in the application's
 * YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new GatekeeperBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new GatekeeperBundle<>(myUserStore, mySessionStore));
 * }</pre>
 * <p>
 * Protect your own routes with {@code @Auth AuthenticatedUser}, or with {@code @PermitAll} and
 * {@code AuthenticatedUser.userIdOf(securityContext.getUserPrincipal())}.
 */
@Singleton
public class GatekeeperBundle<C extends GatekeeperConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperBundle.class);

  /**
   * Secrets shorter than this many bytes are accepted with a warning.
   */
  static final int RECOMMENDED_SECRET_BYTES = 32;

  private final UserStore userStore;
  private final SessionStore sessionStore;
  private final Clock clock;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only: all users and sessions are lost on restart.
   */
  public GatekeeperBundle() {
    this(new InMemoryUserStore(), new InMemorySessionStore());
    log.warn("""
        #################################################################
        # WARNING: Using in-memory user and session stores.             #
        # All accounts and sessions will be lost on restart.            #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param userStore    the user store
   * @param sessionStore the session store
   */
  @Inject
  public GatekeeperBundle(UserStore userStore, SessionStore sessionStore) {
    this(userStore, sessionStore, Clock.systemUTC());
  }

  /**
   * Creates a bundle backed by the supplied stores and clock.
   *
   * @param userStore    the user store
   * @param sessionStore the session store
   * @param clock        source of "now" for issuing and verifying tokens
   */
  public GatekeeperBundle(UserStore userStore, SessionStore sessionStore, Clock clock) {
    this.userStore = userStore;
    this.sessionStore = sessionStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    SigningSecret secret = buildSecret(configuration);
    SessionPolicy policy = new SessionPolicy(configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getSessionTtlSeconds()),
        configuration.isRequireActiveSession());
    TokenCodec codec = new TokenCodec(policy.issuer(), clock);
    SessionManager sessionManager = new SessionManager(secret, codec, policy, sessionStore, clock);

    CredentialManager credentialManager = new CredentialManager(userStore,
        new BCryptPasswordHasher(configuration.getBcryptCost(), new SecureRandom()), sessionManager);
    environment.jersey().register(new AuthResource(credentialManager));
    environment.healthChecks().register("token-codec", new TokenCodecHealthCheck(codec, secret));

    // Bearer auth filter, bound to @Auth parameters and @PermitAll / @RolesAllowed methods.
    environment.jersey().register(new AuthDynamicFeature(
        new BearerAuthFilter(new BearerTokenGate(sessionManager), sessionManager)));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(AuthenticatedUser.class));

    log.info("Gatekeeper sessions: issuer={}, ttl={}, requireActiveSession={}",
        policy.issuer(), policy.ttl(), policy.requireActiveSession());
  }

  private SigningSecret buildSecret(C configuration) {
    String configured = configuration.getJwtSecret();
    if (configured == null || configured.isEmpty()) {
      throw new IllegalStateException(
          "jwtSecret must be configured. Generate a value with: openssl rand -base64 32");
    }
    SigningSecret secret = SigningSecret.fromString(configured);
    if (secret.length() < RECOMMENDED_SECRET_BYTES) {
      log.warn("jwtSecret is only {} bytes; use at least {}. Do not use in production.",
          secret.length(), RECOMMENDED_SECRET_BYTES);
    }
    return secret;
  }
}
