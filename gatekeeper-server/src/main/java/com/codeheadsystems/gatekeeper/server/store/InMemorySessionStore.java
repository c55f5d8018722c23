package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.RecordMetadata;
import com.codeheadsystems.gatekeeper.server.model.Session;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Deletion is soft: rows keep their metadata with {@code deletedAt} set and drop out of every
 * lookup. All sessions are lost on server restart. Suitable for development and integration
 * testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final Clock clock;
  private final AtomicLong sequence = new AtomicLong();
  private final ConcurrentHashMap<Long, Session> rows = new ConcurrentHashMap<>();
  // Secondary indexes, kept in sync with rows.
  private final ConcurrentHashMap<String, Long> tokenIdToId = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Long, Set<Long>> userToIds = new ConcurrentHashMap<>();

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Session create(Session session) {
    long id = sequence.incrementAndGet();
    Session stored = session.withMetadata(RecordMetadata.created(id, clock.instant())).withToken(null);
    // Row and indexes are written inside the user's compute so deleteByUserId cannot interleave.
    userToIds.compute(stored.userId(), (userId, ids) -> {
      Set<Long> result = ids == null ? ConcurrentHashMap.newKeySet() : ids;
      rows.put(id, stored);
      tokenIdToId.put(stored.tokenId(), id);
      result.add(id);
      return result;
    });
    log.debug("Stored session id={} for user={}", id, stored.userId());
    return stored.withToken(session.token());
  }

  @Override
  public Optional<Session> findByTokenId(String tokenId) {
    if (tokenId == null) {
      return Optional.empty();
    }
    Long id = tokenIdToId.get(tokenId);
    if (id == null) {
      return Optional.empty();
    }
    return live(rows.get(id));
  }

  @Override
  public List<Session> findByUserId(long userId) {
    Set<Long> ids = userToIds.get(userId);
    if (ids == null) {
      return List.of();
    }
    return ids.stream()
        .map(rows::get)
        .map(this::live)
        .flatMap(Optional::stream)
        .toList();
  }

  @Override
  public Optional<Session> recordUse(String tokenId, Instant at, String clientIp, String userAgent) {
    Long id = tokenIdToId.get(tokenId);
    if (id == null) {
      return Optional.empty();
    }
    Session updated = rows.computeIfPresent(id, (k, current) -> current.metadata().isDeleted()
        ? current
        : current.withLastUse(at, clientIp, userAgent).withMetadata(current.metadata().updated(at)));
    return live(updated);
  }

  @Override
  public int deleteByUserId(long userId) {
    Instant now = clock.instant();
    AtomicInteger deleted = new AtomicInteger();
    userToIds.computeIfPresent(userId, (key, ids) -> {
      for (Long id : ids) {
        Session before = rows.get(id);
        if (before == null || before.metadata().isDeleted()) {
          continue;
        }
        rows.computeIfPresent(id, (k, current) -> current.withMetadata(current.metadata().deleted(now)));
        tokenIdToId.remove(before.tokenId());
        deleted.incrementAndGet();
      }
      return null;
    });
    log.debug("Deleted {} session(s) for user={}", deleted.get(), userId);
    return deleted.get();
  }

  private Optional<Session> live(Session session) {
    if (session == null || session.metadata().isDeleted()) {
      return Optional.empty();
    }
    return Optional.of(session);
  }
}
