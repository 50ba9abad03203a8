package com.codeheadsystems.fido2.api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.fido2.api.exception.AuthenticatorException;
import com.codeheadsystems.fido2.api.exception.CtapStatusCode;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Validation and equality of the small value types.
 */
class ValueTypesTest {

  @Test
  void sha256_wrongLength_rejected() {
    assertThatThrownBy(() -> new Sha256(new byte[31])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sha256_ofClientDataHash_mapsToCtapStatus() {
    assertThat(Sha256.ofClientDataHash(new byte[32])).isEqualTo(new Sha256(new byte[32]));
    assertThatThrownBy(() -> Sha256.ofClientDataHash(new byte[33]))
        .isInstanceOf(AuthenticatorException.class)
        .satisfies(e -> assertThat(((AuthenticatorException) e).statusCode()).isEqualTo(CtapStatusCode.INVALID_LENGTH));
    assertThatThrownBy(() -> Sha256.ofClientDataHash(null))
        .isInstanceOf(AuthenticatorException.class)
        .satisfies(e -> assertThat(((AuthenticatorException) e).statusCode())
            .isEqualTo(CtapStatusCode.MISSING_PARAMETER));
  }

  @Test
  void sha256_isImmutable() {
    byte[] input = new byte[32];
    Sha256 value = new Sha256(input);
    input[0] = 1;
    value.bytes()[1] = 1;

    assertThat(value).isEqualTo(new Sha256(new byte[32]));
  }

  @Test
  void userHandle_lengthBounds() {
    assertThatThrownBy(() -> new UserHandle(new byte[0])).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new UserHandle(new byte[65])).isInstanceOf(IllegalArgumentException.class);
    assertThat(new UserHandle(new byte[64])).isEqualTo(new UserHandle(new byte[64]));
  }

  @Test
  void credentialId_contentEquality() {
    assertThat(new CredentialId(new byte[]{1, 2})).isEqualTo(new CredentialId(new byte[]{1, 2}))
        .hasSameHashCodeAs(new CredentialId(new byte[]{1, 2}));
    assertThatThrownBy(() -> new CredentialId(new byte[0])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void relyingPartyIdentifier_blank_rejected() {
    assertThatThrownBy(() -> new RelyingPartyIdentifier(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void aaguid_bytesAreBigEndianUuid() {
    Aaguid aaguid = Aaguid.fromString("00112233-4455-6677-8899-aabbccddeeff");

    assertThat(aaguid.bytes()).containsExactly(
        0x00, 0x11, 0x22, 0x33, 0x44, 0x55, 0x66, 0x77, 0x88, 0x99, 0xaa, 0xbb, 0xcc, 0xdd, 0xee, 0xff);
  }

  @Test
  void coseAlgorithmIdentifier_lookup() {
    assertThat(CoseAlgorithmIdentifier.fromValue(-7)).contains(CoseAlgorithmIdentifier.ES256);
    assertThat(CoseAlgorithmIdentifier.fromValue(-257)).isEmpty();
  }

  @Test
  void publicKeyCredentialParameters_es256Detection() {
    assertThat(PublicKeyCredentialParameters.es256().isEs256()).isTrue();
    assertThat(new PublicKeyCredentialParameters(PublicKeyCredentialType.PUBLIC_KEY, -8).isEs256()).isFalse();
  }

  @Test
  void coseKey_uncompressedPoint() {
    byte[] x = new byte[32];
    byte[] y = new byte[32];
    x[31] = 1;
    y[31] = 2;

    byte[] point = new CoseKey(-7, x, y).toUncompressedPoint();

    assertThat(point).hasSize(65);
    assertThat(point[0]).isEqualTo((byte) 0x04);
    assertThat(point[32]).isEqualTo((byte) 1);
    assertThat(point[64]).isEqualTo((byte) 2);
  }

  @Test
  void attestationCertificate_x5cStartsWithLeaf() {
    AttestationCertificate certificate = new AttestationCertificate(new byte[]{1}, List.of(new byte[]{2}, new byte[]{3}));

    assertThat(certificate.x5c()).hasSize(3);
    assertThat(certificate.x5c().get(0)).containsExactly(1);
  }
}
