package com.codeheadsystems.fido2.api.model;

import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import java.io.IOException;

/**
 * User entity of a makeCredential request.
 *
 * @param id          the user handle
 * @param name        the account name, may be null
 * @param displayName the display name, may be null
 */
public record PublicKeyCredentialUserEntity(UserHandle id, String name, String displayName) {

  /**
   * A user entity carrying only the handle, as returned by getAssertion on authenticators
   * without a display.
   *
   * @param id the id
   * @return the public key credential user entity
   */
  public static PublicKeyCredentialUserEntity idOnly(UserHandle id) {
    return new PublicKeyCredentialUserEntity(id, null, null);
  }

  /**
   * Writes the user map, omitting absent members.
   *
   * @param generator the generator
   * @throws IOException on generator failure
   */
  public void writeCbor(CBORGenerator generator) throws IOException {
    int size = 1 + (name == null ? 0 : 1) + (displayName == null ? 0 : 1);
    generator.writeStartObject(null, size);
    generator.writeFieldName("id");
    generator.writeBinary(id.bytes());
    if (name != null) {
      generator.writeFieldName("name");
      generator.writeString(name);
    }
    if (displayName != null) {
      generator.writeFieldName("displayName");
      generator.writeString(displayName);
    }
    generator.writeEndObject();
  }
}
