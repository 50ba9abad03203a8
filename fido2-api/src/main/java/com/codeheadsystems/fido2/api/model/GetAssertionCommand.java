package com.codeheadsystems.fido2.api.model;

import java.util.List;
import java.util.Map;

/**
 * authenticatorGetAssertion (0x02) request. Optional members are null when absent.
 *
 * @param rpId              the relying party id
 * @param clientDataHash    hash of the serialized client data
 * @param allowList         acceptable credentials, optional
 * @param extensions        extension inputs, optional and ignored
 * @param options           authenticator options, optional
 * @param pinUvAuthParam    PIN/UV auth param, optional
 * @param pinUvAuthProtocol PIN/UV protocol version, optional
 */
public record GetAssertionCommand(RelyingPartyIdentifier rpId,
                                  Sha256 clientDataHash,
                                  List<PublicKeyCredentialDescriptor> allowList,
                                  Map<String, Object> extensions,
                                  Map<String, Boolean> options,
                                  byte[] pinUvAuthParam,
                                  Integer pinUvAuthProtocol) {

  /**
   * A request for a discoverable credential of the relying party.
   *
   * @param rpId           the rp id
   * @param clientDataHash the client data hash
   */
  public GetAssertionCommand(RelyingPartyIdentifier rpId, Sha256 clientDataHash) {
    this(rpId, clientDataHash, null, null, null, null, null);
  }

  /**
   * A request restricted to the given credentials.
   *
   * @param rpId           the rp id
   * @param clientDataHash the client data hash
   * @param allowList      the allow list
   */
  public GetAssertionCommand(RelyingPartyIdentifier rpId,
                             Sha256 clientDataHash,
                             List<PublicKeyCredentialDescriptor> allowList) {
    this(rpId, clientDataHash, allowList, null, null, null, null);
  }
}
