package com.codeheadsystems.fido2.api.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * COSE algorithm identifiers (IANA registry) understood by this authenticator.
 */
public enum CoseAlgorithmIdentifier {

  /**
   * ECDSA over P-256 with SHA-256.
   */
  ES256(-7);

  private final int value;

  CoseAlgorithmIdentifier(int value) {
    this.value = value;
  }

  /**
   * Looks up a supported algorithm by its registry value.
   *
   * @param value the value
   * @return the algorithm, or empty when not supported
   */
  public static Optional<CoseAlgorithmIdentifier> fromValue(int value) {
    return Arrays.stream(values()).filter(a -> a.value == value).findFirst();
  }

  /**
   * The registry value.
   *
   * @return the int
   */
  public int value() {
    return value;
  }
}
