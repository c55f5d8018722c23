package com.codeheadsystems.gatekeeper.server.model;

/**
 * A registered account.
 *
 * @param metadata     store bookkeeping
 * @param email        unique account email
 * @param passwordHash one-way hash of the password, never sent to clients
 */
public record User(RecordMetadata metadata, String email, String passwordHash) {

  /**
   * The user identifier.
   *
   * @return the id
   */
  public long id() {
    return metadata.id();
  }

  @Override
  public String toString() {
    return "User[id=" + metadata.id() + ", email=" + email + "]";
  }
}
