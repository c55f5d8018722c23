package com.codeheadsystems.gatekeeper.server.password;

import java.security.SecureRandom;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PasswordHasher} producing OpenBSD-style bcrypt strings ({@code $2y$<cost>$...}).
 * <p>
 * bcrypt only reads the first 72 bytes of the UTF-8 password.
 */
public class BCryptPasswordHasher implements PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(BCryptPasswordHasher.class);

  /**
   * Cost used when none is configured.
   */
  public static final int DEFAULT_COST = 10;

  private static final int SALT_LENGTH = 16;
  private static final int MIN_COST = 4;
  private static final int MAX_COST = 31;

  private final int cost;
  private final SecureRandom random;

  public BCryptPasswordHasher() {
    this(DEFAULT_COST, new SecureRandom());
  }

  /**
   * Instantiates a new BCrypt password hasher.
   *
   * @param cost   log2 of the number of key-expansion rounds, 4 to 31
   * @param random source of salts
   */
  public BCryptPasswordHasher(int cost, SecureRandom random) {
    if (cost < MIN_COST || cost > MAX_COST) {
      throw new IllegalArgumentException("bcrypt cost must be between " + MIN_COST + " and " + MAX_COST);
    }
    if (cost < DEFAULT_COST) {
      log.warn("bcrypt cost {} is below {}. Do not use in production.", cost, DEFAULT_COST);
    }
    this.cost = cost;
    this.random = random;
  }

  @Override
  public String hash(String password) {
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    return OpenBSDBCrypt.generate(password.toCharArray(), salt, cost);
  }

  @Override
  public boolean matches(String password, String storedHash) {
    if (password == null || storedHash == null) {
      return false;
    }
    try {
      return OpenBSDBCrypt.checkPassword(storedHash, password.toCharArray());
    } catch (IllegalArgumentException | DataLengthException e) {
      log.warn("Stored password hash is not a valid bcrypt string: {}", e.getMessage());
      return false;
    }
  }
}
