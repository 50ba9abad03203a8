package com.codeheadsystems.fido2.service.authenticator;

import com.codeheadsystems.fido2.api.model.AuthenticatorData;
import com.codeheadsystems.fido2.api.model.Signature;

/**
 * Output of {@link SecretStore#assertCredential}.
 *
 * @param authData  the authenticator data
 * @param signature the credential's signature over {@code authData || clientDataHash}
 */
public record AssertionResult(AuthenticatorData authData, Signature signature) {
}
