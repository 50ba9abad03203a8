package com.codeheadsystems.fido2.api.common;

import java.security.SecureRandom;

/**
 * Injectable source of randomness for key generation and credential identifiers.
 * Tests may supply a seeded {@link SecureRandom}; production uses the platform default.
 *
 * @param random the underlying secure random
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a provider backed by a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    if (len < 0) {
      throw new IllegalArgumentException("Negative length: " + len);
    }
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }
}
