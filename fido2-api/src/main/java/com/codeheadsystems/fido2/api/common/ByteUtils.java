package com.codeheadsystems.fido2.api.common;

import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Utility methods for the fixed-width encodings used by authenticator data.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Encodes a non-negative value as a big-endian unsigned integer of the given width.
   *
   * @param value  the value
   * @param length the width in bytes (at most 8)
   * @return the byte [ ]
   */
  public static byte[] toUnsignedBigEndian(long value, int length) {
    if (value < 0 || (length < 8 && value >= (1L << (8 * length)))) {
      throw new IllegalArgumentException("Value " + value + " does not fit in " + length + " bytes");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Left-pads (or left-truncates leading zero bytes of) a big-endian magnitude to a fixed width.
   * Used to turn {@code BigInteger.toByteArray()} output into a fixed-size field element.
   *
   * @param magnitude the big-endian magnitude, possibly carrying a sign byte
   * @param length    the target width
   * @return the byte [ ]
   */
  public static byte[] fixedLength(byte[] magnitude, int length) {
    byte[] out = new byte[length];
    if (magnitude.length > length) {
      for (int i = 0; i < magnitude.length - length; i++) {
        if (magnitude[i] != 0) {
          throw new IllegalArgumentException("Value too large for " + length + " bytes");
        }
      }
      System.arraycopy(magnitude, magnitude.length - length, out, 0, length);
    } else {
      System.arraycopy(magnitude, 0, out, length - magnitude.length, magnitude.length);
    }
    return out;
  }

  /**
   * SHA-256 of the input.
   *
   * @param input the input
   * @return the 32-byte digest
   */
  public static byte[] sha256(byte[] input) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
