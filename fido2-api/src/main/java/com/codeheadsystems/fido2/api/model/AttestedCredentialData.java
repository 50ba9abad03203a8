package com.codeheadsystems.fido2.api.model;

import com.codeheadsystems.fido2.api.common.ByteUtils;

/**
 * Attested credential block of authenticator data (WebAuthn section 6.5.1).
 *
 * @param aaguid              the authenticator model
 * @param credentialId        the new credential's id
 * @param credentialPublicKey the new credential's public key
 */
public record AttestedCredentialData(Aaguid aaguid,
                                     CredentialId credentialId,
                                     CoseKey credentialPublicKey) {

  /**
   * Serializes as {@code aaguid(16) || L(2) || credentialId(L) || COSE_Key}.
   *
   * @return the byte [ ]
   */
  public byte[] toBytes() {
    return ByteUtils.concat(
        aaguid.bytes(),
        ByteUtils.toUnsignedBigEndian(credentialId.length(), 2),
        credentialId.bytes(),
        credentialPublicKey.toCbor());
  }
}
