package com.codeheadsystems.fido2.api.model;

import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * Opaque identifier of one credential, assigned by the authenticator at creation time.
 *
 * @param bytes the identifier
 */
public record CredentialId(byte[] bytes) {

  public CredentialId {
    if (bytes == null || bytes.length == 0) {
      throw new IllegalArgumentException("Credential id must not be empty");
    }
    bytes = bytes.clone();
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Length in bytes.
   *
   * @return the int
   */
  public int length() {
    return bytes.length;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CredentialId other && Arrays.equals(bytes, other.bytes);
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
