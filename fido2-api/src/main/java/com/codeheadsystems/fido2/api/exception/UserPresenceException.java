package com.codeheadsystems.fido2.api.exception;

/**
 * The user presence gate could not complete a prompt or wink.
 */
public class UserPresenceException extends AuthenticatorException {

  /**
   * Instantiates a new User presence exception.
   *
   * @param message the message
   */
  public UserPresenceException(final String message) {
    super(CtapStatusCode.OTHER, message);
  }

  /**
   * Instantiates a new User presence exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public UserPresenceException(final String message, final Throwable cause) {
    super(CtapStatusCode.OTHER, message, cause);
  }
}
