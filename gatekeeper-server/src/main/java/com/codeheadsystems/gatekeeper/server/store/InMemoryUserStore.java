package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.RecordMetadata;
import com.codeheadsystems.gatekeeper.server.model.User;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All registrations are lost on server restart. Suitable for development and
 * integration testing only; replace with a database-backed implementation for production.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final Clock clock;
  private final AtomicLong sequence = new AtomicLong();
  private final ConcurrentHashMap<Long, User> byId = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, User> byEmail = new ConcurrentHashMap<>();

  public InMemoryUserStore() {
    this(Clock.systemUTC());
  }

  public InMemoryUserStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryUserStore: registrations will NOT survive restarts. "
        + "Replace with a persistent UserStore for production.");
  }

  @Override
  public User create(String email, String passwordHash) {
    // The id is only consumed once the email slot is won, so losers of a race burn nothing.
    User created = byEmail.compute(email, (key, existing) -> {
      if (existing != null) {
        throw new DuplicateEmailException("Email already registered");
      }
      return new User(RecordMetadata.created(sequence.incrementAndGet(), clock.instant()),
          key, passwordHash);
    });
    byId.put(created.id(), created);
    log.debug("Stored user id={}", created.id());
    return created;
  }

  @Override
  public Optional<User> findByEmail(String email) {
    if (email == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byEmail.get(email));
  }

  @Override
  public Optional<User> findById(long id) {
    return Optional.ofNullable(byId.get(id));
  }
}
