package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.model.auth.LoginRequest;
import com.codeheadsystems.gatekeeper.model.auth.LoginResponse;
import com.codeheadsystems.gatekeeper.model.auth.MessageResponse;
import com.codeheadsystems.gatekeeper.model.auth.RegisterRequest;
import com.codeheadsystems.gatekeeper.model.auth.RegisterResponse;
import com.codeheadsystems.gatekeeper.model.auth.SessionResponse;
import com.codeheadsystems.gatekeeper.model.auth.UserResponse;
import com.codeheadsystems.gatekeeper.server.auth.AuthenticatedUser;
import com.codeheadsystems.gatekeeper.server.auth.SessionManager;
import com.codeheadsystems.gatekeeper.server.model.Session;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.password.PasswordHasher;
import com.codeheadsystems.gatekeeper.server.store.DuplicateEmailException;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind the register, login and logout endpoints.
 * <p>
 * Framework adapters ({@code AuthResource} for JAX-RS / Dropwizard) stay thin wrappers that
 * only translate exceptions into HTTP error responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} - bad / missing request data → HTTP 400</li>
 *   <li>{@link DuplicateEmailException} - email already registered → HTTP 409</li>
 *   <li>{@link SecurityException} - bad credentials or no identity → HTTP 401</li>
 * </ul>
 * Anything else is an internal failure and must surface as an opaque HTTP 500.
 */
public class CredentialManager {

  private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

  /**
   * Returned for both an unknown email and a wrong password.
   */
  public static final String INVALID_CREDENTIALS = "Invalid email or password";
  public static final String NOT_AUTHENTICATED = "Not authenticated";
  public static final String LOGGED_OUT = "Successfully logged out";

  private final UserStore userStore;
  private final PasswordHasher passwordHasher;
  private final SessionManager sessionManager;

  public CredentialManager(UserStore userStore, PasswordHasher passwordHasher,
                           SessionManager sessionManager) {
    this.userStore = userStore;
    this.passwordHasher = passwordHasher;
    this.sessionManager = sessionManager;
  }

  /**
   * Registers a new account.
   *
   * @param req the request
   * @return the created user, without any password material
   * @throws IllegalArgumentException if the email or password is missing or malformed
   * @throws DuplicateEmailException  if the email is already registered
   */
  public RegisterResponse register(RegisterRequest req) {
    String email = req.validatedEmail();
    String password = req.validatedPassword();
    User user = userStore.create(email, passwordHasher.hash(password));
    log.debug("Registered user={}", user.id());
    return new RegisterResponse(toResponse(user));
  }

  /**
   * Checks credentials and issues a new session.
   *
   * @param req       the request
   * @param clientIp  the client address
   * @param userAgent the client user agent
   * @return the user and the new session, including its bearer token
   * @throws IllegalArgumentException if the email or password is missing or malformed
   * @throws SecurityException        if the email is unknown or the password is wrong
   */
  public LoginResponse login(LoginRequest req, String clientIp, String userAgent) {
    String email = req.validatedEmail();
    String password = req.validatedPassword();
    Optional<User> found = userStore.findByEmail(email);
    if (found.isEmpty()) {
      log.debug("login: unknown email");
      throw new SecurityException(INVALID_CREDENTIALS);
    }
    User user = found.get();
    if (!passwordHasher.matches(password, user.passwordHash())) {
      log.debug("login: password mismatch for user={}", user.id());
      throw new SecurityException(INVALID_CREDENTIALS);
    }
    Session session = sessionManager.issue(user, clientIp, userAgent);
    return new LoginResponse(toResponse(user), toResponse(session));
  }

  /**
   * Revokes every session of the user bound to the request.
   *
   * @param userId the bound user id, {@link AuthenticatedUser#NO_USER} when none
   * @return the confirmation message
   * @throws SecurityException if no user is bound
   */
  public MessageResponse logout(long userId) {
    if (userId == AuthenticatedUser.NO_USER) {
      throw new SecurityException(NOT_AUTHENTICATED);
    }
    sessionManager.invalidate(userId);
    return new MessageResponse(LOGGED_OUT);
  }

  private static UserResponse toResponse(User user) {
    return new UserResponse(user.id(), user.email(),
        iso(user.metadata().createdAt()), iso(user.metadata().updatedAt()));
  }

  private static SessionResponse toResponse(Session session) {
    return new SessionResponse(session.id(), session.userId(), session.token(),
        iso(session.expiresAt()), iso(session.lastUsedAt()),
        session.lastUsedIp(), session.lastUsedLoc());
  }

  private static String iso(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
