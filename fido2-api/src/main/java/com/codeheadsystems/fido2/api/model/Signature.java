package com.codeheadsystems.fido2.api.model;

import java.util.Arrays;

/**
 * DER-encoded ECDSA signature.
 *
 * @param bytes the signature
 */
public record Signature(byte[] bytes) {

  public Signature {
    bytes = bytes.clone();
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Signature other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Signature[" + bytes.length + " bytes]";
  }
}
