package com.codeheadsystems.fido2.api.exception;

/**
 * Key generation, key decoding or signing failed.
 */
public class CryptoOperationException extends AuthenticatorException {

  /**
   * Instantiates a new Crypto operation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CryptoOperationException(final String message, final Throwable cause) {
    super(CtapStatusCode.OTHER, message, cause);
  }
}
