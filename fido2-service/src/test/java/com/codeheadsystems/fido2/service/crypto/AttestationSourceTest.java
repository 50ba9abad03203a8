package com.codeheadsystems.fido2.service.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.fido2.api.common.RandomProvider;
import com.codeheadsystems.fido2.api.model.Aaguid;
import com.codeheadsystems.fido2.api.model.Signature;
import com.codeheadsystems.fido2.service.config.AuthenticatorConfig;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Base64;
import org.bouncycastle.asn1.ASN1OctetString;
import org.junit.jupiter.api.Test;

class AttestationSourceTest {

  private static final byte[] MESSAGE = "authenticatorData||clientDataHash".getBytes(StandardCharsets.UTF_8);

  @Test
  void fromPem_softU2fTestCertificate_signsVerifiably() throws Exception {
    AttestationSource source = AttestationSource.fromPem(
        resource("/attestation/soft-u2f-cert.pem"), resource("/attestation/soft-u2f-key.pem"));

    assertThat(source.isSelfAttestation()).isFalse();
    X509Certificate certificate = parse(source.publicKeyDocument());
    assertThat(certificate.getSubjectX500Principal().getName()).isEqualTo("CN=Soft U2F Testing");
    assertThat(source.certificate().x5c()).hasSize(1);

    Signature signature = source.sign(MESSAGE, new SecureRandom());
    assertThat(EcKeys.verify(certificate.getPublicKey(), MESSAGE, signature)).isTrue();
  }

  @Test
  void fromPem_mismatchedKey_rejected() throws Exception {
    AttestationSource generated = AttestationSource.generate(Aaguid.ZERO, new RandomProvider());
    String otherCertificate = "-----BEGIN CERTIFICATE-----\n"
        + Base64.getMimeEncoder().encodeToString(generated.publicKeyDocument())
        + "\n-----END CERTIFICATE-----\n";

    assertThatThrownBy(() -> AttestationSource.fromPem(otherCertificate, resource("/attestation/soft-u2f-key.pem")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not match");
  }

  @Test
  void fromPem_garbage_rejected() {
    assertThatThrownBy(() -> AttestationSource.fromPem("not a pem", "also not a pem"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void generate_embedsAaguidAndIsNotCa() throws Exception {
    AttestationSource source = AttestationSource.generate(
        AuthenticatorConfig.SOFTWARE_AAGUID, new RandomProvider());

    X509Certificate certificate = parse(source.publicKeyDocument());
    assertThat(certificate.getBasicConstraints()).isEqualTo(-1);
    byte[] extension = certificate.getExtensionValue(AttestationSource.ID_FIDO_GEN_CE_AAGUID.getId());
    byte[] inner = ASN1OctetString.getInstance(ASN1OctetString.getInstance(extension).getOctets()).getOctets();
    assertThat(inner).isEqualTo(AuthenticatorConfig.SOFTWARE_AAGUID.bytes());
    assertThat(EcKeys.verify(certificate.getPublicKey(), MESSAGE, source.sign(MESSAGE, new SecureRandom())))
        .isTrue();
  }

  @Test
  void selfAttestation_hasNoKeyOrCertificate() {
    AttestationSource source = AttestationSource.selfAttestation();

    assertThat(source.isSelfAttestation()).isTrue();
    assertThat(source.certificate()).isNull();
    assertThatThrownBy(() -> source.sign(MESSAGE, new SecureRandom())).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(source::publicKeyDocument).isInstanceOf(IllegalStateException.class);
  }

  private static X509Certificate parse(byte[] der) throws Exception {
    return (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(new ByteArrayInputStream(der));
  }

  private static String resource(String name) throws IOException {
    try (InputStream in = AttestationSourceTest.class.getResourceAsStream(name)) {
      return new String(in.readAllBytes(), StandardCharsets.US_ASCII);
    }
  }
}
