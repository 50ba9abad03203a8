package com.codeheadsystems.fido2.api.model;

import com.codeheadsystems.fido2.api.common.ByteUtils;
import java.nio.charset.StandardCharsets;

/**
 * Identity of the relying party requesting a credential, usually its effective domain.
 *
 * @param id the relying party id, e.g. {@code "example.com"}
 */
public record RelyingPartyIdentifier(String id) {

  public RelyingPartyIdentifier {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Relying party id must not be blank");
    }
  }

  /**
   * UTF-8 bytes of the id.
   *
   * @return the byte [ ]
   */
  public byte[] bytes() {
    return id.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * The {@code rpIdHash} carried in authenticator data.
   *
   * @return SHA-256 of the UTF-8 id
   */
  public Sha256 hash() {
    return new Sha256(ByteUtils.sha256(bytes()));
  }

  @Override
  public String toString() {
    return id;
  }
}
