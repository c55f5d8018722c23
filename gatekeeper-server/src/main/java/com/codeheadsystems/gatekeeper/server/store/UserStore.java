package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.User;
import java.util.Optional;

/**
 * Storage abstraction for registered users.
 * <p>
 * Implementations must be thread-safe and must enforce email uniqueness atomically, e.g. with
 * a unique index on {@code users.email}; a check-then-insert done by the caller is not enough
 * when two registrations race.
 */
public interface UserStore {

  /**
   * Creates a user.
   *
   * @param email        the email, unique among live users
   * @param passwordHash the already-hashed password
   * @return the stored user
   * @throws DuplicateEmailException if the email is already registered
   */
  User create(String email, String passwordHash);

  /**
   * Find by email.
   *
   * @param email the email
   * @return the user, or empty if not registered
   */
  Optional<User> findByEmail(String email);

  /**
   * Find by id.
   *
   * @param id the user id
   * @return the user, or empty if unknown
   */
  Optional<User> findById(long id);
}
