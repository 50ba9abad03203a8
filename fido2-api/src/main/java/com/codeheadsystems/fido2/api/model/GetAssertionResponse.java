package com.codeheadsystems.fido2.api.model;

import com.codeheadsystems.fido2.api.cbor.CtapCbor;

/**
 * authenticatorGetAssertion response.
 *
 * @param credential          the credential that signed
 * @param authData            the authenticator data, without attested credential block
 * @param signature           the signature over {@code authData || clientDataHash}
 * @param user                the user, set only for discoverable lookups
 * @param numberOfCredentials the number of matching discoverable credentials, set only for
 *                            discoverable lookups
 */
public record GetAssertionResponse(PublicKeyCredentialDescriptor credential,
                                   AuthenticatorData authData,
                                   Signature signature,
                                   PublicKeyCredentialUserEntity user,
                                   Integer numberOfCredentials) {

  /**
   * CTAP2 encoding {@code {1: credential, 2: authData, 3: signature, 4: user,
   * 5: numberOfCredentials}} with absent members omitted.
   *
   * @return the byte [ ]
   */
  public byte[] toCbor() {
    return CtapCbor.encode(generator -> {
      int size = 3 + (user == null ? 0 : 1) + (numberOfCredentials == null ? 0 : 1);
      generator.writeStartObject(null, size);
      generator.writeFieldId(1);
      credential.writeCbor(generator);
      generator.writeFieldId(2);
      generator.writeBinary(authData.toBytes());
      generator.writeFieldId(3);
      generator.writeBinary(signature.bytes());
      if (user != null) {
        generator.writeFieldId(4);
        user.writeCbor(generator);
      }
      if (numberOfCredentials != null) {
        generator.writeFieldId(5);
        generator.writeNumber(numberOfCredentials);
      }
      generator.writeEndObject();
    });
  }
}
