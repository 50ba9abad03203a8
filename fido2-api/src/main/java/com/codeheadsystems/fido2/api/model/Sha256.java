package com.codeheadsystems.fido2.api.model;

import com.codeheadsystems.fido2.api.common.ByteUtils;
import com.codeheadsystems.fido2.api.exception.AuthenticatorException;
import com.codeheadsystems.fido2.api.exception.CtapStatusCode;
import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * A 32-byte SHA-256 value: the client data hash of a request, or an rp id hash.
 *
 * @param bytes the digest
 */
public record Sha256(byte[] bytes) {

  public static final int LENGTH = 32;

  public Sha256 {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("SHA-256 value must be " + LENGTH + " bytes");
    }
    bytes = bytes.clone();
  }

  /**
   * Hashes the given input.
   *
   * @param input the input
   * @return the sha 256
   */
  public static Sha256 digest(byte[] input) {
    return new Sha256(ByteUtils.sha256(input));
  }

  /**
   * Wraps the raw {@code clientDataHash} member of a request.
   *
   * @param clientDataHash the client data hash
   * @return the sha 256
   * @throws AuthenticatorException with {@code MISSING_PARAMETER} if absent, {@code INVALID_LENGTH}
   *                                if not 32 bytes
   */
  public static Sha256 ofClientDataHash(byte[] clientDataHash) {
    if (clientDataHash == null) {
      throw new AuthenticatorException(CtapStatusCode.MISSING_PARAMETER, "clientDataHash is required");
    }
    if (clientDataHash.length != LENGTH) {
      throw new AuthenticatorException(CtapStatusCode.INVALID_LENGTH,
          "clientDataHash must be " + LENGTH + " bytes, got " + clientDataHash.length);
    }
    return new Sha256(clientDataHash);
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Sha256 other && Arrays.equals(bytes, other.bytes);
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
