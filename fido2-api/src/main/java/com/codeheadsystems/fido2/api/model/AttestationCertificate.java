package com.codeheadsystems.fido2.api.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * The {@code x5c} member of a packed attestation statement.
 *
 * @param attestationCertificate DER certificate of the attestation key
 * @param caCertificateChain     DER certificates of the issuing chain, may be empty
 */
public record AttestationCertificate(byte[] attestationCertificate, List<byte[]> caCertificateChain) {

  public AttestationCertificate {
    caCertificateChain = caCertificateChain == null ? List.of() : List.copyOf(caCertificateChain);
  }

  /**
   * The certificates in {@code x5c} order: attestation certificate first.
   *
   * @return the list
   */
  public List<byte[]> x5c() {
    return Stream.concat(Stream.of(attestationCertificate), caCertificateChain.stream()).toList();
  }
}
