package com.codeheadsystems.fido2.api.exception;

/**
 * A credential handle does not resolve to a stored record.
 */
public class CredentialNotFoundException extends AuthenticatorException {

  /**
   * Instantiates a new Credential not found exception.
   *
   * @param message the message
   */
  public CredentialNotFoundException(final String message) {
    super(CtapStatusCode.NO_CREDENTIALS, message);
  }
}
