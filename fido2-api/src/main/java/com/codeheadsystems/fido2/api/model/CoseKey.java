package com.codeheadsystems.fido2.api.model;

import com.codeheadsystems.fido2.api.cbor.CtapCbor;
import java.util.Arrays;

/**
 * EC2 public key in COSE_Key form (RFC 9053), P-256 only.
 * <p>
 * Encoded as {@code {1: 2, 3: alg, -1: 1, -2: x, -3: y}}.
 *
 * @param alg the COSE algorithm the key is used with
 * @param x   the 32-byte affine x coordinate
 * @param y   the 32-byte affine y coordinate
 */
public record CoseKey(int alg, byte[] x, byte[] y) {

  public static final int KTY_EC2 = 2;
  public static final int CRV_P256 = 1;
  public static final int COORDINATE_LENGTH = 32;

  public CoseKey {
    if (x == null || y == null || x.length != COORDINATE_LENGTH || y.length != COORDINATE_LENGTH) {
      throw new IllegalArgumentException("P-256 coordinates must be " + COORDINATE_LENGTH + " bytes");
    }
    x = x.clone();
    y = y.clone();
  }

  @Override
  public byte[] x() {
    return x.clone();
  }

  @Override
  public byte[] y() {
    return y.clone();
  }

  /**
   * Uncompressed SEC1 point encoding {@code 0x04 || x || y}.
   *
   * @return the byte [ ]
   */
  public byte[] toUncompressedPoint() {
    byte[] out = new byte[1 + 2 * COORDINATE_LENGTH];
    out[0] = 0x04;
    System.arraycopy(x, 0, out, 1, COORDINATE_LENGTH);
    System.arraycopy(y, 0, out, 1 + COORDINATE_LENGTH, COORDINATE_LENGTH);
    return out;
  }

  /**
   * CTAP2 canonical CBOR encoding.
   *
   * @return the byte [ ]
   */
  public byte[] toCbor() {
    return CtapCbor.encode(generator -> {
      generator.writeStartObject(null, 5);
      generator.writeFieldId(1);
      generator.writeNumber(KTY_EC2);
      generator.writeFieldId(3);
      generator.writeNumber(alg);
      generator.writeFieldId(-1);
      generator.writeNumber(CRV_P256);
      generator.writeFieldId(-2);
      generator.writeBinary(x);
      generator.writeFieldId(-3);
      generator.writeBinary(y);
      generator.writeEndObject();
    });
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CoseKey other
        && alg == other.alg
        && Arrays.equals(x, other.x)
        && Arrays.equals(y, other.y);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * alg + Arrays.hashCode(x)) + Arrays.hashCode(y);
  }

  @Override
  public String toString() {
    return "CoseKey[alg=" + alg + "]";
  }
}
