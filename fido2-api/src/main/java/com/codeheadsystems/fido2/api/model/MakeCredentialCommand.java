package com.codeheadsystems.fido2.api.model;

import java.util.List;
import java.util.Map;

/**
 * authenticatorMakeCredential (0x01) request. Optional members are null when absent.
 *
 * @param clientDataHash        hash of the serialized client data
 * @param rp                    the relying party
 * @param user                  the user account
 * @param pubKeyCredParams      algorithm preferences, most preferred first
 * @param excludeList           credentials that must not already exist, optional
 * @param extensions            extension inputs, optional and ignored
 * @param options               authenticator options, optional
 * @param pinUvAuthParam        PIN/UV auth param, optional
 * @param pinUvAuthProtocol     PIN/UV protocol version, optional
 * @param enterpriseAttestation enterprise attestation selector, optional
 */
public record MakeCredentialCommand(Sha256 clientDataHash,
                                    PublicKeyCredentialRpEntity rp,
                                    PublicKeyCredentialUserEntity user,
                                    List<PublicKeyCredentialParameters> pubKeyCredParams,
                                    List<PublicKeyCredentialDescriptor> excludeList,
                                    Map<String, Object> extensions,
                                    Map<String, Boolean> options,
                                    byte[] pinUvAuthParam,
                                    Integer pinUvAuthProtocol,
                                    Integer enterpriseAttestation) {

  /**
   * A request carrying only the required members.
   *
   * @param clientDataHash   the client data hash
   * @param rp               the rp
   * @param user             the user
   * @param pubKeyCredParams the pub key cred params
   */
  public MakeCredentialCommand(Sha256 clientDataHash,
                               PublicKeyCredentialRpEntity rp,
                               PublicKeyCredentialUserEntity user,
                               List<PublicKeyCredentialParameters> pubKeyCredParams) {
    this(clientDataHash, rp, user, pubKeyCredParams, null, null, null, null, null, null);
  }
}
