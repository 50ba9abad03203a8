package com.codeheadsystems.fido2.api.exception;

/**
 * Terminal failure of an authenticator command.
 * <p>
 * Protocol rejections (unsupported request shapes, unknown algorithms, missing credentials,
 * denied presence) are thrown as this type directly. Failures of a collaborator (storage,
 * cryptography, the presence gate) use the dedicated subclasses so callers can tell them
 * apart; every layer rethrows them unchanged.
 */
public class AuthenticatorException extends RuntimeException {

  private final CtapStatusCode statusCode;

  /**
   * Instantiates a new Authenticator exception with a default message.
   *
   * @param statusCode the status code
   */
  public AuthenticatorException(final CtapStatusCode statusCode) {
    this(statusCode, statusCode.name());
  }

  /**
   * Instantiates a new Authenticator exception.
   *
   * @param statusCode the status code
   * @param message    the message
   */
  public AuthenticatorException(final CtapStatusCode statusCode, final String message) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * Instantiates a new Authenticator exception.
   *
   * @param statusCode the status code
   * @param message    the message
   * @param cause      the cause
   */
  public AuthenticatorException(final CtapStatusCode statusCode, final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * The CTAP status code reported to the platform.
   *
   * @return the status code
   */
  public CtapStatusCode statusCode() {
    return statusCode;
  }
}
