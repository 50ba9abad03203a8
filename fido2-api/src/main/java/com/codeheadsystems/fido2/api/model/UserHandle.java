package com.codeheadsystems.fido2.api.model;

import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * Opaque user account handle chosen by the relying party, 1 to 64 bytes.
 *
 * @param bytes the handle
 */
public record UserHandle(byte[] bytes) {

  public static final int MAX_LENGTH = 64;

  public UserHandle {
    if (bytes == null || bytes.length == 0 || bytes.length > MAX_LENGTH) {
      throw new IllegalArgumentException("User handle must be 1.." + MAX_LENGTH + " bytes");
    }
    bytes = bytes.clone();
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof UserHandle other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return Hex.toHexString(bytes);
  }
}
