package com.codeheadsystems.fido2.service.crypto;

import com.codeheadsystems.fido2.api.common.ByteUtils;
import com.codeheadsystems.fido2.api.common.RandomProvider;
import com.codeheadsystems.fido2.api.exception.AuthenticatorException;
import com.codeheadsystems.fido2.api.exception.CredentialNotFoundException;
import com.codeheadsystems.fido2.api.exception.CtapStatusCode;
import com.codeheadsystems.fido2.api.model.Aaguid;
import com.codeheadsystems.fido2.api.model.AttestedCredentialData;
import com.codeheadsystems.fido2.api.model.AuthenticatorData;
import com.codeheadsystems.fido2.api.model.CoseAlgorithmIdentifier;
import com.codeheadsystems.fido2.api.model.CredentialHandle;
import com.codeheadsystems.fido2.api.model.CredentialId;
import com.codeheadsystems.fido2.api.model.PackedAttestationStatement;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialDescriptor;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialParameters;
import com.codeheadsystems.fido2.api.model.RelyingPartyIdentifier;
import com.codeheadsystems.fido2.api.model.Sha256;
import com.codeheadsystems.fido2.api.model.Signature;
import com.codeheadsystems.fido2.api.model.UserHandle;
import com.codeheadsystems.fido2.service.authenticator.AssertionResult;
import com.codeheadsystems.fido2.service.authenticator.AttestationResult;
import com.codeheadsystems.fido2.service.authenticator.SecretStore;
import com.codeheadsystems.fido2.service.config.AuthenticatorConfig;
import com.codeheadsystems.fido2.service.store.CredentialStorage;
import com.codeheadsystems.fido2.service.store.PrivateKeyCredentialSource;
import java.security.KeyPair;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Software implementation of the credential engine. P-256 keys live in the
 * {@link CredentialStorage} as PKCS#8 bytes; every operation runs under a single lock so that
 * credential creation, counter updates and listings are serialized.
 * <p>
 * Exception contract: storage failures surface as
 * {@link com.codeheadsystems.fido2.api.exception.CredentialStorageException}, key and signature
 * failures as {@link com.codeheadsystems.fido2.api.exception.CryptoOperationException}, and
 * unknown credentials as {@link CredentialNotFoundException}. None are retried. When the first
 * attestation of a new credential fails, the credential is deleted before the failure is rethrown.
 */
@Singleton
public class SoftwareCryptoStore implements SecretStore {

  /**
   * Largest value of the 32-bit signature counter.
   */
  public static final long MAX_SIGN_COUNT = 0xFFFFFFFFL;

  private static final Logger log = LoggerFactory.getLogger(SoftwareCryptoStore.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final CredentialStorage storage;
  private final AttestationSource attestationSource;
  private final Aaguid aaguid;
  private final int credentialIdLength;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Software crypto store.
   *
   * @param storage           the storage
   * @param attestationSource the attestation source
   * @param config            the config
   */
  @Inject
  public SoftwareCryptoStore(final CredentialStorage storage,
                             final AttestationSource attestationSource,
                             final AuthenticatorConfig config) {
    this.storage = storage;
    this.attestationSource = attestationSource;
    this.aaguid = config.aaguid();
    this.credentialIdLength = config.credentialIdLength();
    this.randomProvider = config.randomProvider();
    log.info("SoftwareCryptoStore(aaguid={}, selfAttestation={})", aaguid, attestationSource.isSelfAttestation());
  }

  @Override
  public CredentialHandle makeCredential(final PublicKeyCredentialParameters parameters,
                                         final RelyingPartyIdentifier rpId,
                                         final UserHandle userHandle,
                                         final boolean discoverable) {
    log.debug("makeCredential(rpId={}, discoverable={})", rpId, discoverable);
    CoseAlgorithmIdentifier algorithm = CoseAlgorithmIdentifier.fromValue(parameters.alg())
        .filter(alg -> parameters.isEs256())
        .orElseThrow(() -> new AuthenticatorException(CtapStatusCode.UNSUPPORTED_ALGORITHM,
            "Unsupported credential algorithm " + parameters.alg()));
    lock.lock();
    try {
      KeyPair keyPair = EcKeys.generate(randomProvider.random());
      PrivateKeyCredentialSource credential = new PrivateKeyCredentialSource(
          algorithm,
          newCredentialId(),
          rpId,
          userHandle,
          keyPair.getPrivate().getEncoded(),
          discoverable,
          0L,
          Instant.now());
      if (discoverable) {
        storage.putDiscoverable(credential);
      } else {
        storage.put(credential);
      }
      return credential.handle();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public AttestationResult attest(final RelyingPartyIdentifier rpId,
                                  final CredentialHandle credential,
                                  final Sha256 clientDataHash,
                                  final boolean userPresent,
                                  final boolean userVerified) {
    log.debug("attest(rpId={}, credential={})", rpId, credential.credentialId());
    lock.lock();
    try {
      PrivateKeyCredentialSource record = load(rpId, credential);
      try {
        return attestRecord(record, rpId, clientDataHash, userPresent, userVerified);
      } catch (RuntimeException e) {
        if (record.signCount() == 0L) {
          discard(record, e);
        }
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public AssertionResult assertCredential(final RelyingPartyIdentifier rpId,
                                          final CredentialHandle credential,
                                          final Sha256 clientDataHash,
                                          final boolean userPresent,
                                          final boolean userVerified) {
    log.debug("assertCredential(rpId={}, credential={})", rpId, credential.credentialId());
    lock.lock();
    try {
      PrivateKeyCredentialSource record = load(rpId, credential);
      PublicKeyCredentialSource source = PublicKeyCredentialSource.from(record);
      long signCount = nextSignCount(record);
      AuthenticatorData authData = new AuthenticatorData(rpId.hash(), userPresent, userVerified, signCount, null);
      Signature signature = source.sign(
          ByteUtils.concat(authData.toBytes(), clientDataHash.bytes()), randomProvider.random());
      storage.updateSignCount(record.id(), signCount);
      return new AssertionResult(authData, signature);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<CredentialHandle> listDiscoverableCredentials(final RelyingPartyIdentifier rpId) {
    log.debug("listDiscoverableCredentials(rpId={})", rpId);
    lock.lock();
    try {
      return storage.listDiscoverable(rpId);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<CredentialHandle> listSpecifiedCredentials(final RelyingPartyIdentifier rpId,
                                                         final List<PublicKeyCredentialDescriptor> credentialList) {
    log.debug("listSpecifiedCredentials(rpId={}, count={})", rpId, credentialList.size());
    lock.lock();
    try {
      return storage.listSpecified(rpId, credentialList);
    } finally {
      lock.unlock();
    }
  }

  // ── Internals ───────────────────────────────────────────────────────────────

  private AttestationResult attestRecord(final PrivateKeyCredentialSource record,
                                         final RelyingPartyIdentifier rpId,
                                         final Sha256 clientDataHash,
                                         final boolean userPresent,
                                         final boolean userVerified) {
    PublicKeyCredentialSource source = PublicKeyCredentialSource.from(record);
    long signCount = nextSignCount(record);
    AuthenticatorData authData = new AuthenticatorData(
        rpId.hash(),
        userPresent,
        userVerified,
        signCount,
        new AttestedCredentialData(aaguid, source.id(), source.credentialPublicKey()));
    byte[] message = ByteUtils.concat(authData.toBytes(), clientDataHash.bytes());
    PackedAttestationStatement statement;
    if (attestationSource.isSelfAttestation()) {
      statement = new PackedAttestationStatement(source.algorithm().value(),
          source.sign(message, randomProvider.random()), null);
    } else {
      statement = new PackedAttestationStatement(CoseAlgorithmIdentifier.ES256.value(),
          attestationSource.sign(message, randomProvider.random()), attestationSource.certificate());
    }
    storage.updateSignCount(record.id(), signCount);
    return new AttestationResult(authData, statement);
  }

  // Only for records whose counter is still 0: they were never returned to a platform.
  private void discard(final PrivateKeyCredentialSource record, final RuntimeException cause) {
    log.warn("Attestation failed for new credential on rpId={}; removing it", record.rpId(), cause);
    try {
      storage.delete(record.id());
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
    }
  }

  private CredentialId newCredentialId() {
    CredentialId id = new CredentialId(randomProvider.randomBytes(credentialIdLength));
    while (storage.get(id).isPresent()) {
      log.warn("Credential id collision; regenerating");
      id = new CredentialId(randomProvider.randomBytes(credentialIdLength));
    }
    return id;
  }

  private PrivateKeyCredentialSource load(final RelyingPartyIdentifier rpId, final CredentialHandle credential) {
    PrivateKeyCredentialSource record = storage.get(credential)
        .orElseThrow(() -> new CredentialNotFoundException("Unknown credential " + credential.credentialId()));
    if (!record.rpId().equals(rpId)) {
      throw new CredentialNotFoundException("Credential " + credential.credentialId() + " is not bound to " + rpId);
    }
    return record;
  }

  private long nextSignCount(final PrivateKeyCredentialSource record) {
    if (record.signCount() >= MAX_SIGN_COUNT) {
      throw new AuthenticatorException(CtapStatusCode.OTHER, "Signature counter exhausted for " + record.id());
    }
    return record.signCount() + 1;
  }
}
