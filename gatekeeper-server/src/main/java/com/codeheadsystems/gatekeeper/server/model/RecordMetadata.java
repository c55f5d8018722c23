package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;

/**
 * Bookkeeping columns shared by every stored record.
 * <p>
 * Composed into {@link User} and {@link Session} rather than inherited. Values are assigned
 * by the store; callers never build metadata for a record they are about to create.
 *
 * @param id        store-assigned identifier, always positive
 * @param createdAt when the record was created
 * @param updatedAt when the record was last modified
 * @param deletedAt soft-delete marker, {@code null} while the record is live
 */
public record RecordMetadata(long id, Instant createdAt, Instant updatedAt, Instant deletedAt) {

  /**
   * Metadata for a record created at {@code now}.
   *
   * @param id  the id
   * @param now the creation instant
   * @return the record metadata
   */
  public static RecordMetadata created(long id, Instant now) {
    return new RecordMetadata(id, now, now, null);
  }

  /**
   * Is deleted.
   *
   * @return true once the record has been soft-deleted
   */
  public boolean isDeleted() {
    return deletedAt != null;
  }

  /**
   * Copy touched at {@code now}.
   *
   * @param now the update instant
   * @return the record metadata
   */
  public RecordMetadata updated(Instant now) {
    return new RecordMetadata(id, createdAt, now, deletedAt);
  }

  /**
   * Copy soft-deleted at {@code now}.
   *
   * @param now the deletion instant
   * @return the record metadata
   */
  public RecordMetadata deleted(Instant now) {
    return new RecordMetadata(id, createdAt, now, now);
  }
}
