package com.codeheadsystems.fido2.api.model;

import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import java.io.IOException;

/**
 * One entry of a {@code pubKeyCredParams} preference list. The algorithm is kept as the raw
 * COSE value so that requests may name algorithms this authenticator does not implement.
 *
 * @param type the credential type
 * @param alg  the COSE algorithm value
 */
public record PublicKeyCredentialParameters(PublicKeyCredentialType type, int alg) {

  /**
   * The ES256 public-key parameters.
   *
   * @return the public key credential parameters
   */
  public static PublicKeyCredentialParameters es256() {
    return new PublicKeyCredentialParameters(PublicKeyCredentialType.PUBLIC_KEY,
        CoseAlgorithmIdentifier.ES256.value());
  }

  /**
   * True for a public-key entry requesting ES256.
   *
   * @return the boolean
   */
  public boolean isEs256() {
    return type == PublicKeyCredentialType.PUBLIC_KEY && alg == CoseAlgorithmIdentifier.ES256.value();
  }

  /**
   * Writes {@code {"alg": alg, "type": type}}.
   *
   * @param generator the generator
   * @throws IOException on generator failure
   */
  public void writeCbor(CBORGenerator generator) throws IOException {
    generator.writeStartObject(null, 2);
    generator.writeFieldName("alg");
    generator.writeNumber(alg);
    generator.writeFieldName("type");
    generator.writeString(type.value());
    generator.writeEndObject();
  }
}
