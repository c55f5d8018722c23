package com.codeheadsystems.gatekeeper.client.model;

/**
 * Logical name of a gatekeeper server known to the client.
 *
 * @param id the identifier
 */
public record ServerIdentifier(String id) {

  @Override
  public String toString() {
    return id;
  }
}
