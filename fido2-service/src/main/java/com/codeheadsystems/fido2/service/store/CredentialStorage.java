package com.codeheadsystems.fido2.service.store;

import com.codeheadsystems.fido2.api.model.CredentialHandle;
import com.codeheadsystems.fido2.api.model.CredentialId;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialDescriptor;
import com.codeheadsystems.fido2.api.model.RelyingPartyIdentifier;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for credential records.
 * <p>
 * Records are keyed by credential id. Discoverable records are additionally indexed by
 * (relying party, user handle); a newer discoverable record for the same pair replaces the
 * index entry, so lookups by relying party return only the latest credential per user.
 * Listings are ordered newest first.
 * <p>
 * Implementations report backend failures as
 * {@link com.codeheadsystems.fido2.api.exception.CredentialStorageException}. Typical
 * production implementations back this with an encrypted key-value store.
 */
public interface CredentialStorage {

  /**
   * Stores or replaces a discoverable record and points the (rp, user) index at it.
   *
   * @param credential the credential
   */
  void putDiscoverable(PrivateKeyCredentialSource credential);

  /**
   * Stores or replaces a non-discoverable record. It is reachable only by credential id.
   *
   * @param credential the credential
   */
  void put(PrivateKeyCredentialSource credential);

  /**
   * Retrieves the record a handle refers to.
   *
   * @param credentialHandle the credential handle
   * @return the record, or empty if the credential id is unknown
   */
  default Optional<PrivateKeyCredentialSource> get(CredentialHandle credentialHandle) {
    return get(credentialHandle.credentialId());
  }

  /**
   * Retrieves a record by credential id.
   *
   * @param credentialId the credential id
   * @return the record, or empty if unknown
   */
  Optional<PrivateKeyCredentialSource> get(CredentialId credentialId);

  /**
   * Persists a new signature counter for a stored record.
   *
   * @param credentialId the credential id
   * @param signCount    the new counter, not lower than the stored one
   */
  void updateSignCount(CredentialId credentialId, long signCount);

  /**
   * Removes a record. If it was the indexed discoverable credential for its (rp, user) pair,
   * the index falls back to the newest remaining discoverable record for that pair.
   *
   * @param credentialId the credential id
   * @return true if a record was removed
   */
  boolean delete(CredentialId credentialId);

  /**
   * The current discoverable credential of every user of a relying party.
   *
   * @param rpId the rp id
   * @return the handles, newest first
   */
  List<CredentialHandle> listDiscoverable(RelyingPartyIdentifier rpId);

  /**
   * The subset of the given descriptors that exist in storage and are bound to the relying party.
   *
   * @param rpId           the rp id
   * @param credentialList the credential list
   * @return the handles, newest first, without duplicates
   */
  List<CredentialHandle> listSpecified(RelyingPartyIdentifier rpId,
                                       List<PublicKeyCredentialDescriptor> credentialList);
}
