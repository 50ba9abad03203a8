package com.codeheadsystems.fido2.service.store;

import com.codeheadsystems.fido2.api.model.CoseAlgorithmIdentifier;
import com.codeheadsystems.fido2.api.model.CredentialHandle;
import com.codeheadsystems.fido2.api.model.CredentialId;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialDescriptor;
import com.codeheadsystems.fido2.api.model.RelyingPartyIdentifier;
import com.codeheadsystems.fido2.api.model.UserHandle;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * The durable credential record. Owned by the {@link CredentialStorage} once persisted.
 *
 * @param algorithm    the credential algorithm
 * @param id           the credential id
 * @param rpId         the relying party the credential is bound to
 * @param userHandle   the user the credential belongs to
 * @param privateKey   PKCS#8 encoding of the credential private key
 * @param discoverable whether the credential can be found by relying party id alone
 * @param signCount    the last signature counter value issued for this credential
 * @param createdAt    when the credential was generated
 */
public record PrivateKeyCredentialSource(CoseAlgorithmIdentifier algorithm,
                                         CredentialId id,
                                         RelyingPartyIdentifier rpId,
                                         UserHandle userHandle,
                                         byte[] privateKey,
                                         boolean discoverable,
                                         long signCount,
                                         Instant createdAt) {

  public PrivateKeyCredentialSource {
    Objects.requireNonNull(algorithm, "algorithm");
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(rpId, "rpId");
    Objects.requireNonNull(userHandle, "userHandle");
    Objects.requireNonNull(privateKey, "privateKey");
    Objects.requireNonNull(createdAt, "createdAt");
    privateKey = privateKey.clone();
  }

  @Override
  public byte[] privateKey() {
    return privateKey.clone();
  }

  /**
   * The handle the orchestrator uses to refer to this record.
   *
   * @return the credential handle
   */
  public CredentialHandle handle() {
    return new CredentialHandle(PublicKeyCredentialDescriptor.publicKey(id), rpId, userHandle);
  }

  /**
   * A copy of this record carrying a new counter value.
   *
   * @param newSignCount the new sign count
   * @return the private key credential source
   */
  public PrivateKeyCredentialSource withSignCount(long newSignCount) {
    return new PrivateKeyCredentialSource(algorithm, id, rpId, userHandle, privateKey,
        discoverable, newSignCount, createdAt);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PrivateKeyCredentialSource other
        && algorithm == other.algorithm
        && id.equals(other.id)
        && rpId.equals(other.rpId)
        && userHandle.equals(other.userHandle)
        && Arrays.equals(privateKey, other.privateKey)
        && discoverable == other.discoverable
        && signCount == other.signCount
        && createdAt.equals(other.createdAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(algorithm, id, rpId, userHandle, discoverable, signCount, createdAt);
  }

  // Key material stays out of logs.
  @Override
  public String toString() {
    return "PrivateKeyCredentialSource[id=" + id + ", rpId=" + rpId + ", userHandle=" + userHandle
        + ", discoverable=" + discoverable + ", signCount=" + signCount + "]";
  }
}
