package com.codeheadsystems.fido2.service.config;

import com.codeheadsystems.fido2.api.common.RandomProvider;
import com.codeheadsystems.fido2.api.model.Aaguid;
import java.util.Properties;

/**
 * Configuration for the software authenticator.
 * Holds the model identifier, the credential id size and the randomness source.
 *
 * @param aaguid             the AAGUID reported by getInfo and embedded in attested credential data
 * @param credentialIdLength length in bytes of generated credential ids
 * @param randomProvider     randomness for keys, credential ids and signatures
 */
public record AuthenticatorConfig(Aaguid aaguid, int credentialIdLength, RandomProvider randomProvider) {

  public static final String AAGUID_PROPERTY = "fido2.aaguid";
  public static final String CREDENTIAL_ID_LENGTH_PROPERTY = "fido2.credentialIdLength";

  public static final int DEFAULT_CREDENTIAL_ID_LENGTH = 32;
  // CTAP caps credential ids in allow lists at 1023 bytes; ids shorter than 16 bytes risk collisions.
  public static final int MIN_CREDENTIAL_ID_LENGTH = 16;
  public static final int MAX_CREDENTIAL_ID_LENGTH = 1023;

  /**
   * AAGUID of this software authenticator model.
   */
  public static final Aaguid SOFTWARE_AAGUID = Aaguid.fromString("6d44ba9b-f6ec-4f4e-9a52-3c0b5a1e0f0d");

  /**
   * Default configuration: the software AAGUID, 32-byte credential ids and a default {@link RandomProvider}.
   */
  public static final AuthenticatorConfig DEFAULT =
      new AuthenticatorConfig(SOFTWARE_AAGUID, DEFAULT_CREDENTIAL_ID_LENGTH, new RandomProvider());

  public AuthenticatorConfig {
    if (aaguid == null) {
      throw new IllegalArgumentException("aaguid is required");
    }
    if (randomProvider == null) {
      throw new IllegalArgumentException("randomProvider is required");
    }
    if (credentialIdLength < MIN_CREDENTIAL_ID_LENGTH || credentialIdLength > MAX_CREDENTIAL_ID_LENGTH) {
      throw new IllegalArgumentException("credentialIdLength must be between " + MIN_CREDENTIAL_ID_LENGTH
          + " and " + MAX_CREDENTIAL_ID_LENGTH + ": " + credentialIdLength);
    }
  }

  /**
   * Creates a test configuration with the all-zero AAGUID.
   *
   * @return the authenticator config
   */
  public static AuthenticatorConfig forTesting() {
    return new AuthenticatorConfig(Aaguid.ZERO, DEFAULT_CREDENTIAL_ID_LENGTH, new RandomProvider());
  }

  /**
   * Reads {@code fido2.aaguid} and {@code fido2.credentialIdLength}; absent keys keep their
   * {@link #DEFAULT} values.
   *
   * @param properties the properties
   * @return the authenticator config
   * @throws IllegalArgumentException if a value is malformed
   */
  public static AuthenticatorConfig fromProperties(Properties properties) {
    String aaguid = properties.getProperty(AAGUID_PROPERTY);
    String length = properties.getProperty(CREDENTIAL_ID_LENGTH_PROPERTY);
    try {
      return new AuthenticatorConfig(
          aaguid == null || aaguid.isBlank() ? DEFAULT.aaguid() : Aaguid.fromString(aaguid.trim()),
          length == null || length.isBlank() ? DEFAULT.credentialIdLength() : Integer.parseInt(length.trim()),
          new RandomProvider());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + CREDENTIAL_ID_LENGTH_PROPERTY + ": " + length, e);
    }
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   *
   * @param randomProvider the random provider
   * @return the authenticator config
   */
  public AuthenticatorConfig withRandomProvider(RandomProvider randomProvider) {
    return new AuthenticatorConfig(aaguid, credentialIdLength, randomProvider);
  }
}
