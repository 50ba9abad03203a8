package com.codeheadsystems.fido2.service.crypto;

import com.codeheadsystems.fido2.api.model.CoseAlgorithmIdentifier;
import com.codeheadsystems.fido2.api.model.CoseKey;
import com.codeheadsystems.fido2.api.model.CredentialId;
import com.codeheadsystems.fido2.api.model.Signature;
import com.codeheadsystems.fido2.service.store.PrivateKeyCredentialSource;
import java.security.PrivateKey;
import java.security.SecureRandom;

/**
 * Signing view of a stored credential, alive only for one sign operation and never persisted.
 */
public class PublicKeyCredentialSource {

  private final CredentialId id;
  private final CoseAlgorithmIdentifier algorithm;
  private final PrivateKey privateKey;
  private final CoseKey credentialPublicKey;

  private PublicKeyCredentialSource(CredentialId id,
                                    CoseAlgorithmIdentifier algorithm,
                                    PrivateKey privateKey,
                                    CoseKey credentialPublicKey) {
    this.id = id;
    this.algorithm = algorithm;
    this.privateKey = privateKey;
    this.credentialPublicKey = credentialPublicKey;
  }

  /**
   * Decodes the private key of a record and derives its public key.
   *
   * @param source the source
   * @return the public key credential source
   * @throws com.codeheadsystems.fido2.api.exception.CryptoOperationException if the stored key
   *                                                                          is unusable
   */
  public static PublicKeyCredentialSource from(PrivateKeyCredentialSource source) {
    PrivateKey privateKey = EcKeys.decodePrivateKey(source.privateKey());
    return new PublicKeyCredentialSource(source.id(), source.algorithm(), privateKey,
        EcKeys.derivePublicKey(privateKey, source.algorithm()));
  }

  public CredentialId id() {
    return id;
  }

  public CoseAlgorithmIdentifier algorithm() {
    return algorithm;
  }

  public CoseKey credentialPublicKey() {
    return credentialPublicKey;
  }

  /**
   * Signs with the credential's own private key.
   *
   * @param message the message
   * @param random  the random
   * @return the signature
   */
  public Signature sign(byte[] message, SecureRandom random) {
    return EcKeys.sign(privateKey, message, random);
  }
}
