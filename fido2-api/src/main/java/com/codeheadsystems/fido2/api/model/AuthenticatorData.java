package com.codeheadsystems.fido2.api.model;

import com.codeheadsystems.fido2.api.common.ByteUtils;

/**
 * Authenticator data (WebAuthn section 6.1), built fresh for every operation.
 *
 * @param rpIdHash                the SHA-256 of the relying party id
 * @param userPresent             the UP flag
 * @param userVerified            the UV flag
 * @param signCount               the signature counter, an unsigned 32-bit value
 * @param attestedCredentialData  the attested credential block, null for assertions
 */
public record AuthenticatorData(Sha256 rpIdHash,
                                boolean userPresent,
                                boolean userVerified,
                                long signCount,
                                AttestedCredentialData attestedCredentialData) {

  public static final int FLAG_USER_PRESENT = 0x01;
  public static final int FLAG_USER_VERIFIED = 0x04;
  public static final int FLAG_ATTESTED_CREDENTIAL_DATA = 0x40;

  public AuthenticatorData {
    if (signCount < 0 || signCount > 0xFFFFFFFFL) {
      throw new IllegalArgumentException("Signature counter out of range: " + signCount);
    }
  }

  /**
   * The flags byte.
   *
   * @return the byte
   */
  public byte flags() {
    int flags = 0;
    if (userPresent) {
      flags |= FLAG_USER_PRESENT;
    }
    if (userVerified) {
      flags |= FLAG_USER_VERIFIED;
    }
    if (attestedCredentialData != null) {
      flags |= FLAG_ATTESTED_CREDENTIAL_DATA;
    }
    return (byte) flags;
  }

  /**
   * Serializes as {@code rpIdHash(32) || flags(1) || signCount(4) || [attestedCredentialData]}.
   * These are the bytes that attestation and assertion signatures cover.
   *
   * @return the byte [ ]
   */
  public byte[] toBytes() {
    byte[] head = ByteUtils.concat(
        rpIdHash.bytes(),
        new byte[]{flags()},
        ByteUtils.toUnsignedBigEndian(signCount, 4));
    if (attestedCredentialData == null) {
      return head;
    }
    return ByteUtils.concat(head, attestedCredentialData.toBytes());
  }
}
