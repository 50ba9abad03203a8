package com.codeheadsystems.fido2.api.model;

/**
 * Reference to a stored credential, handed to the orchestrator in place of key material.
 *
 * @param descriptor the public descriptor carrying the credential id
 * @param rpId       the relying party the credential is bound to
 * @param userHandle the user the credential belongs to
 */
public record CredentialHandle(PublicKeyCredentialDescriptor descriptor,
                               RelyingPartyIdentifier rpId,
                               UserHandle userHandle) {

  /**
   * The credential id.
   *
   * @return the credential id
   */
  public CredentialId credentialId() {
    return descriptor.id();
  }
}
