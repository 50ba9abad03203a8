package com.codeheadsystems.fido2.api.model;

import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import java.io.IOException;

/**
 * An attestation statement of some format.
 */
public interface AttestationStatement {

  /**
   * The attestation statement format identifier, e.g. {@code "packed"}.
   *
   * @return the string
   */
  String format();

  /**
   * Writes the {@code attStmt} map.
   *
   * @param generator the generator
   * @throws IOException on generator failure
   */
  void writeCbor(CBORGenerator generator) throws IOException;
}
