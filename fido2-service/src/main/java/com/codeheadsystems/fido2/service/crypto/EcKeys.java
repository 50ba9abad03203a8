package com.codeheadsystems.fido2.service.crypto;

import com.codeheadsystems.fido2.api.common.ByteUtils;
import com.codeheadsystems.fido2.api.exception.CryptoOperationException;
import com.codeheadsystems.fido2.api.model.CoseAlgorithmIdentifier;
import com.codeheadsystems.fido2.api.model.CoseKey;
import com.codeheadsystems.fido2.api.model.Signature;
import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.PKCS8EncodedKeySpec;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.math.ec.ECPoint;

/**
 * P-256 key handling for ES256 credentials and attestation keys.
 * <p>
 * Key generation and ECDSA use the JCA; public points are recomputed from private scalars
 * with Bouncy Castle curve arithmetic so that stored records need only the private key.
 */
public class EcKeys {

  public static final String CURVE = "secp256r1";
  public static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

  private static final ECNamedCurveParameterSpec P256 = ECNamedCurveTable.getParameterSpec(CURVE);

  private EcKeys() {
  }

  /**
   * Generates a fresh P-256 key pair.
   *
   * @param random the random
   * @return the key pair
   * @throws CryptoOperationException if the platform cannot generate the key
   */
  public static KeyPair generate(SecureRandom random) {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
      generator.initialize(new ECGenParameterSpec(CURVE), random);
      return generator.generateKeyPair();
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("P-256 key generation failed", e);
    }
  }

  /**
   * Decodes a PKCS#8 EC private key.
   *
   * @param pkcs8 the pkcs 8
   * @return the private key
   * @throws CryptoOperationException if the encoding is not a valid EC key
   */
  public static PrivateKey decodePrivateKey(byte[] pkcs8) {
    try {
      return KeyFactory.getInstance("EC").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("Invalid stored private key", e);
    }
  }

  /**
   * Computes the COSE public key {@code d * G} of a P-256 private key.
   *
   * @param privateKey the private key
   * @param algorithm  the algorithm recorded in the COSE key
   * @return the cose key
   */
  public static CoseKey derivePublicKey(PrivateKey privateKey, CoseAlgorithmIdentifier algorithm) {
    if (!(privateKey instanceof ECPrivateKey ecPrivateKey)) {
      throw new CryptoOperationException("Not an EC private key: " + privateKey.getAlgorithm(), null);
    }
    BigInteger d = ecPrivateKey.getS();
    ECPoint q = P256.getG().multiply(d).normalize();
    return new CoseKey(algorithm.value(),
        q.getAffineXCoord().getEncoded(),
        q.getAffineYCoord().getEncoded());
  }

  /**
   * Converts a JCA EC public key to COSE form.
   *
   * @param publicKey the public key
   * @param algorithm the algorithm
   * @return the cose key
   */
  public static CoseKey toCoseKey(PublicKey publicKey, CoseAlgorithmIdentifier algorithm) {
    if (!(publicKey instanceof ECPublicKey ecPublicKey)) {
      throw new IllegalArgumentException("Not an EC public key: " + publicKey.getAlgorithm());
    }
    int size = CoseKey.COORDINATE_LENGTH;
    return new CoseKey(algorithm.value(),
        fixed(ecPublicKey.getW().getAffineX(), size),
        fixed(ecPublicKey.getW().getAffineY(), size));
  }

  /**
   * ECDSA-SHA256 signature, DER encoded.
   *
   * @param privateKey the private key
   * @param message    the message
   * @param random     the random
   * @return the signature
   * @throws CryptoOperationException if signing fails
   */
  public static Signature sign(PrivateKey privateKey, byte[] message, SecureRandom random) {
    try {
      java.security.Signature signer = java.security.Signature.getInstance(SIGNATURE_ALGORITHM);
      signer.initSign(privateKey, random);
      signer.update(message);
      return new Signature(signer.sign());
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("ECDSA signing failed", e);
    }
  }

  /**
   * Rebuilds a JCA public key from its COSE form.
   *
   * @param coseKey the cose key
   * @return the public key
   * @throws CryptoOperationException if the point is not on P-256
   */
  public static PublicKey toPublicKey(CoseKey coseKey) {
    try {
      AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
      parameters.init(new ECGenParameterSpec(CURVE));
      ECParameterSpec spec = parameters.getParameterSpec(ECParameterSpec.class);
      java.security.spec.ECPoint w = new java.security.spec.ECPoint(
          new BigInteger(1, coseKey.x()), new BigInteger(1, coseKey.y()));
      return KeyFactory.getInstance("EC").generatePublic(new ECPublicKeySpec(w, spec));
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("Invalid COSE public key", e);
    }
  }

  /**
   * Verifies an ECDSA-SHA256 signature.
   *
   * @param publicKey the public key
   * @param message   the message
   * @param signature the signature
   * @return true if the signature is valid
   */
  public static boolean verify(PublicKey publicKey, byte[] message, Signature signature) {
    try {
      java.security.Signature verifier = java.security.Signature.getInstance(SIGNATURE_ALGORITHM);
      verifier.initVerify(publicKey);
      verifier.update(message);
      return verifier.verify(signature.bytes());
    } catch (java.security.SignatureException e) {
      return false;
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("ECDSA verification failed", e);
    }
  }

  private static byte[] fixed(BigInteger value, int length) {
    return ByteUtils.fixedLength(value.toByteArray(), length);
  }
}
