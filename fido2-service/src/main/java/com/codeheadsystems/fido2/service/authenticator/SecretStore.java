package com.codeheadsystems.fido2.service.authenticator;

import com.codeheadsystems.fido2.api.model.CredentialHandle;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialDescriptor;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialParameters;
import com.codeheadsystems.fido2.api.model.RelyingPartyIdentifier;
import com.codeheadsystems.fido2.api.model.Sha256;
import com.codeheadsystems.fido2.api.model.UserHandle;
import java.util.List;

/**
 * Credential key management as seen by the {@link Authenticator}: creates credentials and
 * signs with them without ever exposing private key material.
 * <p>
 * Implementations must be thread-safe. Failures are thrown as
 * {@link com.codeheadsystems.fido2.api.exception.AuthenticatorException} subtypes.
 */
public interface SecretStore {

  /**
   * Generates and persists a new credential. Every call produces independent key material,
   * even for identical inputs.
   *
   * @param parameters   the selected algorithm
   * @param rpId         the relying party
   * @param userHandle   the user
   * @param discoverable whether the credential is discoverable by relying party id
   * @return the handle of the new credential
   */
  CredentialHandle makeCredential(PublicKeyCredentialParameters parameters,
                                  RelyingPartyIdentifier rpId,
                                  UserHandle userHandle,
                                  boolean discoverable);

  /**
   * Produces authenticator data with the attested credential block and an attestation
   * statement over it.
   *
   * @param rpId           the relying party
   * @param credential     the credential to attest
   * @param clientDataHash the client data hash
   * @param userPresent    the UP flag
   * @param userVerified   the UV flag
   * @return the attestation result
   * @throws com.codeheadsystems.fido2.api.exception.CredentialNotFoundException if the handle
   *                                                                             is unknown
   */
  AttestationResult attest(RelyingPartyIdentifier rpId,
                           CredentialHandle credential,
                           Sha256 clientDataHash,
                           boolean userPresent,
                           boolean userVerified);

  /**
   * Produces authenticator data and the credential's own signature over it.
   *
   * @param rpId           the relying party
   * @param credential     the credential that signs
   * @param clientDataHash the client data hash
   * @param userPresent    the UP flag
   * @param userVerified   the UV flag
   * @return the assertion result
   * @throws com.codeheadsystems.fido2.api.exception.CredentialNotFoundException if the handle
   *                                                                             is unknown
   */
  AssertionResult assertCredential(RelyingPartyIdentifier rpId,
                                   CredentialHandle credential,
                                   Sha256 clientDataHash,
                                   boolean userPresent,
                                   boolean userVerified);

  /**
   * Discoverable credentials of a relying party, newest first.
   *
   * @param rpId the rp id
   * @return the list
   */
  List<CredentialHandle> listDiscoverableCredentials(RelyingPartyIdentifier rpId);

  /**
   * The stored credentials among the given descriptors that belong to the relying party,
   * newest first.
   *
   * @param rpId           the rp id
   * @param credentialList the credential list
   * @return the list
   */
  List<CredentialHandle> listSpecifiedCredentials(RelyingPartyIdentifier rpId,
                                                  List<PublicKeyCredentialDescriptor> credentialList);
}
