package com.codeheadsystems.fido2.service.crypto;

import com.codeheadsystems.fido2.api.common.RandomProvider;
import com.codeheadsystems.fido2.api.exception.CryptoOperationException;
import com.codeheadsystems.fido2.api.model.Aaguid;
import com.codeheadsystems.fido2.api.model.AttestationCertificate;
import com.codeheadsystems.fido2.api.model.CoseAlgorithmIdentifier;
import com.codeheadsystems.fido2.api.model.Signature;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The authenticator's own attestation identity: a long-lived P-256 key and its certificate.
 * <p>
 * With a key, attestation statements are basic ("full") attestation: the engine signs
 * {@code authenticatorData || clientDataHash} with this key and ships the certificate chain as
 * {@code x5c}. {@link #selfAttestation()} carries no key; the engine then signs with the new
 * credential's own key and omits {@code x5c}.
 * <p>
 * Shared read-only across all attestation operations for the process lifetime.
 */
public class AttestationSource {

  /**
   * FIDO certificate extension carrying the authenticator AAGUID.
   */
  public static final ASN1ObjectIdentifier ID_FIDO_GEN_CE_AAGUID = new ASN1ObjectIdentifier("1.3.6.1.4.1.45724.1.1.4");

  private static final Logger log = LoggerFactory.getLogger(AttestationSource.class);
  private static final AttestationSource SELF = new AttestationSource(null, null);
  private static final BouncyCastleProvider PROVIDER = new BouncyCastleProvider();

  private final PrivateKey privateKey;
  private final AttestationCertificate certificate;

  private AttestationSource(PrivateKey privateKey, AttestationCertificate certificate) {
    this.privateKey = privateKey;
    this.certificate = certificate;
  }

  /**
   * Self attestation: no attestation key, statements are signed by the credential key.
   *
   * @return the attestation source
   */
  public static AttestationSource selfAttestation() {
    return SELF;
  }

  /**
   * Basic attestation with the given key and certificate chain.
   *
   * @param privateKey  the attestation private key
   * @param certificate the attestation certificate, whose public key must match the private key
   * @param caChain     issuing certificates, leaf issuer first; may be empty
   * @return the attestation source
   * @throws IllegalArgumentException if the key does not belong to the certificate
   */
  public static AttestationSource of(PrivateKey privateKey,
                                     X509Certificate certificate,
                                     List<X509Certificate> caChain) {
    // Re-decode so the key belongs to the same provider as the JCA signer in EcKeys.
    PrivateKey signingKey = EcKeys.decodePrivateKey(privateKey.getEncoded());
    if (!EcKeys.derivePublicKey(signingKey, CoseAlgorithmIdentifier.ES256)
        .equals(EcKeys.toCoseKey(certificate.getPublicKey(), CoseAlgorithmIdentifier.ES256))) {
      throw new IllegalArgumentException("Attestation key does not match certificate "
          + certificate.getSubjectX500Principal());
    }
    try {
      List<byte[]> chain = new ArrayList<>();
      for (X509Certificate ca : caChain) {
        chain.add(ca.getEncoded());
      }
      return new AttestationSource(signingKey, new AttestationCertificate(certificate.getEncoded(), chain));
    } catch (CertificateEncodingException e) {
      throw new IllegalArgumentException("Unencodable attestation certificate", e);
    }
  }

  /**
   * Loads basic attestation material from PEM text.
   * The key may be SEC1 ({@code EC PRIVATE KEY}) or PKCS#8 ({@code PRIVATE KEY}).
   *
   * @param certificatePem the attestation certificate
   * @param privateKeyPem  the attestation private key
   * @return the attestation source
   * @throws IllegalArgumentException if either document cannot be parsed
   */
  public static AttestationSource fromPem(String certificatePem, String privateKeyPem) {
    try {
      Object certificateObject = readPem(certificatePem);
      if (!(certificateObject instanceof X509CertificateHolder holder)) {
        throw new IllegalArgumentException("Expected a PEM certificate");
      }
      X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(holder);

      Object keyObject = readPem(privateKeyPem);
      JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(PROVIDER);
      PrivateKey privateKey;
      if (keyObject instanceof PEMKeyPair keyPair) {
        privateKey = converter.getKeyPair(keyPair).getPrivate();
      } else if (keyObject instanceof PrivateKeyInfo keyInfo) {
        privateKey = converter.getPrivateKey(keyInfo);
      } else {
        throw new IllegalArgumentException("Expected a PEM EC private key");
      }
      log.info("Loaded attestation certificate {}", certificate.getSubjectX500Principal());
      return of(privateKey, certificate, List.of());
    } catch (IOException | CertificateException e) {
      throw new IllegalArgumentException("Unreadable attestation PEM", e);
    }
  }

  /**
   * Generates a fresh self-signed attestation certificate meeting the packed attestation
   * certificate requirements (WebAuthn section 8.2.1). Development use only: relying parties
   * cannot chain it to a trusted root.
   *
   * @param aaguid         the AAGUID to embed in the certificate
   * @param randomProvider the random provider
   * @return the attestation source
   */
  public static AttestationSource generate(Aaguid aaguid, RandomProvider randomProvider) {
    log.warn("Generating a self-signed attestation certificate: development use only.");
    SecureRandom random = randomProvider.random();
    KeyPair keyPair = EcKeys.generate(random);
    X500Name subject = new X500Name(
        "C=US, O=codeheadsystems, OU=Authenticator Attestation, CN=Software FIDO2 Authenticator");
    Instant now = Instant.now();
    try {
      X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
          subject,
          new BigInteger(64, random),
          Date.from(now.minus(Duration.ofDays(1))),
          Date.from(now.plus(Duration.ofDays(3650))),
          subject,
          keyPair.getPublic());
      builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
      builder.addExtension(ID_FIDO_GEN_CE_AAGUID, false, new DEROctetString(aaguid.bytes()));
      ContentSigner signer = new JcaContentSignerBuilder(EcKeys.SIGNATURE_ALGORITHM)
          .setSecureRandom(random)
          .build(keyPair.getPrivate());
      X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(builder.build(signer));
      return of(keyPair.getPrivate(), certificate, List.of());
    } catch (IOException | OperatorCreationException | CertificateException e) {
      throw new CryptoOperationException("Attestation certificate generation failed", e);
    }
  }

  private static Object readPem(String pem) throws IOException {
    try (PEMParser parser = new PEMParser(new StringReader(pem))) {
      Object object = parser.readObject();
      if (object == null) {
        throw new IllegalArgumentException("No PEM object found");
      }
      return object;
    }
  }

  /**
   * Whether statements must be signed with the credential key instead.
   *
   * @return the boolean
   */
  public boolean isSelfAttestation() {
    return privateKey == null;
  }

  /**
   * The attestation certificate chain for {@code x5c}.
   *
   * @return the certificate chain, null for self attestation
   */
  public AttestationCertificate certificate() {
    return certificate;
  }

  /**
   * DER encoding of the attestation certificate.
   *
   * @return the byte [ ]
   */
  public byte[] publicKeyDocument() {
    if (certificate == null) {
      throw new IllegalStateException("Self attestation has no certificate");
    }
    return certificate.attestationCertificate().clone();
  }

  /**
   * Signs a message with the attestation key.
   *
   * @param message the message, {@code authenticatorData || clientDataHash}
   * @param random  the random
   * @return the signature
   */
  public Signature sign(byte[] message, SecureRandom random) {
    if (privateKey == null) {
      throw new IllegalStateException("Self attestation has no attestation key");
    }
    return EcKeys.sign(privateKey, message, random);
  }
}
