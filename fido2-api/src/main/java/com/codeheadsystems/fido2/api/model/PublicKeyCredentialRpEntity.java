package com.codeheadsystems.fido2.api.model;

/**
 * Relying party entity of a makeCredential request.
 *
 * @param id   the relying party id
 * @param name human-palatable name, shown in presence prompts
 */
public record PublicKeyCredentialRpEntity(RelyingPartyIdentifier id, String name) {
}
