package com.codeheadsystems.fido2.api.model;

import com.codeheadsystems.fido2.api.cbor.CtapCbor;

/**
 * authenticatorMakeCredential response: the attestation object parts.
 *
 * @param authData the authenticator data with the attested credential block
 * @param attStmt  the attestation statement
 */
public record MakeCredentialResponse(AuthenticatorData authData, AttestationStatement attStmt) {

  /**
   * CTAP2 encoding {@code {1: fmt, 2: authData, 3: attStmt}}.
   *
   * @return the byte [ ]
   */
  public byte[] toCbor() {
    return CtapCbor.encode(generator -> {
      generator.writeStartObject(null, 3);
      generator.writeFieldId(1);
      generator.writeString(attStmt.format());
      generator.writeFieldId(2);
      generator.writeBinary(authData.toBytes());
      generator.writeFieldId(3);
      attStmt.writeCbor(generator);
      generator.writeEndObject();
    });
  }
}
