package com.codeheadsystems.fido2.api.model;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Authenticator model identifier embedded in attested credential data.
 *
 * @param uuid the uuid
 */
public record Aaguid(UUID uuid) {

  /**
   * All-zero AAGUID, used by authenticators that do not disclose their model.
   */
  public static final Aaguid ZERO = new Aaguid(new UUID(0L, 0L));

  public Aaguid {
    if (uuid == null) {
      throw new IllegalArgumentException("AAGUID must not be null");
    }
  }

  /**
   * Parses the canonical UUID string form.
   *
   * @param value the value
   * @return the aaguid
   */
  public static Aaguid fromString(String value) {
    return new Aaguid(UUID.fromString(value));
  }

  /**
   * The 16-byte big-endian encoding.
   *
   * @return the byte [ ]
   */
  public byte[] bytes() {
    return ByteBuffer.allocate(16)
        .putLong(uuid.getMostSignificantBits())
        .putLong(uuid.getLeastSignificantBits())
        .array();
  }

  @Override
  public String toString() {
    return uuid.toString();
  }
}
