package com.codeheadsystems.fido2.service.authenticator;

import com.codeheadsystems.fido2.api.model.AttestationStatement;
import com.codeheadsystems.fido2.api.model.AuthenticatorData;

/**
 * Output of {@link SecretStore#attest}.
 *
 * @param authData the authenticator data with attested credential block
 * @param attStmt  the attestation statement
 */
public record AttestationResult(AuthenticatorData authData, AttestationStatement attStmt) {
}
