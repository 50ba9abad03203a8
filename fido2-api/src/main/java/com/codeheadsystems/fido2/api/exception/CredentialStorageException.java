package com.codeheadsystems.fido2.api.exception;

/**
 * The credential storage backend failed to read or write a record.
 */
public class CredentialStorageException extends AuthenticatorException {

  /**
   * Instantiates a new Credential storage exception.
   *
   * @param message the message
   */
  public CredentialStorageException(final String message) {
    super(CtapStatusCode.OTHER, message);
  }

  /**
   * Instantiates a new Credential storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CredentialStorageException(final String message, final Throwable cause) {
    super(CtapStatusCode.OTHER, message, cause);
  }
}
