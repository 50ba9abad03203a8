package com.codeheadsystems.fido2.api.model;

import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import java.io.IOException;
import java.util.List;

/**
 * Public reference to a credential, as exchanged with the platform in allow and exclude lists.
 *
 * @param type       the credential type
 * @param id         the credential id
 * @param transports transport hints, may be empty
 */
public record PublicKeyCredentialDescriptor(PublicKeyCredentialType type,
                                            CredentialId id,
                                            List<String> transports) {

  public PublicKeyCredentialDescriptor {
    if (type == null || id == null) {
      throw new IllegalArgumentException("Credential descriptor requires a type and an id");
    }
    transports = transports == null ? List.of() : List.copyOf(transports);
  }

  /**
   * A public-key descriptor without transport hints.
   *
   * @param id the id
   * @return the public key credential descriptor
   */
  public static PublicKeyCredentialDescriptor publicKey(CredentialId id) {
    return new PublicKeyCredentialDescriptor(PublicKeyCredentialType.PUBLIC_KEY, id, List.of());
  }

  /**
   * Writes {@code {"id": bytes, "type": type}}. Transport hints are not echoed.
   *
   * @param generator the generator
   * @throws IOException on generator failure
   */
  public void writeCbor(CBORGenerator generator) throws IOException {
    generator.writeStartObject(null, 2);
    generator.writeFieldName("id");
    generator.writeBinary(id.bytes());
    generator.writeFieldName("type");
    generator.writeString(type.value());
    generator.writeEndObject();
  }
}
