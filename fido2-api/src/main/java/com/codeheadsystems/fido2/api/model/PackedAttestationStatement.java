package com.codeheadsystems.fido2.api.model;

import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import java.io.IOException;
import java.util.List;

/**
 * Packed attestation statement (WebAuthn section 8.2).
 *
 * @param alg the COSE algorithm of the signature
 * @param sig the signature over {@code authenticatorData || clientDataHash}
 * @param x5c the attestation certificate chain; null for self attestation
 */
public record PackedAttestationStatement(int alg, Signature sig, AttestationCertificate x5c)
    implements AttestationStatement {

  public static final String FORMAT = "packed";

  @Override
  public String format() {
    return FORMAT;
  }

  /**
   * True when signed by the credential key itself.
   *
   * @return the boolean
   */
  public boolean isSelfAttestation() {
    return x5c == null;
  }

  @Override
  public void writeCbor(CBORGenerator generator) throws IOException {
    generator.writeStartObject(null, x5c == null ? 2 : 3);
    generator.writeFieldName("alg");
    generator.writeNumber(alg);
    generator.writeFieldName("sig");
    generator.writeBinary(sig.bytes());
    if (x5c != null) {
      List<byte[]> certificates = x5c.x5c();
      generator.writeFieldName("x5c");
      generator.writeStartArray(null, certificates.size());
      for (byte[] certificate : certificates) {
        generator.writeBinary(certificate);
      }
      generator.writeEndArray();
    }
    generator.writeEndObject();
  }
}
