package com.codeheadsystems.gatekeeper.server.auth;

/**
 * Resolves the client address of a request that may have passed through proxies.
 */
public final class ClientAddress {

  public static final String FORWARDED_FOR = "X-Forwarded-For";
  public static final String REAL_IP = "X-Real-IP";

  private ClientAddress() {
  }

  /**
   * First {@code X-Forwarded-For} entry, else {@code X-Real-IP}, else the socket address.
   *
   * @param forwardedFor the {@code X-Forwarded-For} header, may be {@code null}
   * @param realIp       the {@code X-Real-IP} header, may be {@code null}
   * @param remoteAddr   the socket peer address, may be {@code null}
   * @return the client address, or {@code null} if none is known
   */
  public static String resolve(String forwardedFor, String realIp, String remoteAddr) {
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      int comma = forwardedFor.indexOf(',');
      String first = (comma < 0 ? forwardedFor : forwardedFor.substring(0, comma)).trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    return remoteAddr;
  }
}
