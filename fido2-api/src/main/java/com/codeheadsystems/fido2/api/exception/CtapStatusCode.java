package com.codeheadsystems.fido2.api.exception;

/**
 * CTAP 2.1 status codes (section 8.2) returned by this authenticator.
 */
public enum CtapStatusCode {

  OK(0x00),
  INVALID_COMMAND(0x01),
  INVALID_PARAMETER(0x02),
  INVALID_LENGTH(0x03),
  MISSING_PARAMETER(0x14),
  UNSUPPORTED_ALGORITHM(0x26),
  OPERATION_DENIED(0x27),
  UNSUPPORTED_OPTION(0x2B),
  INVALID_OPTION(0x2C),
  NO_CREDENTIALS(0x2E),
  OTHER(0x7F);

  private final int code;

  CtapStatusCode(int code) {
    this.code = code;
  }

  /**
   * The status byte as sent on the wire.
   *
   * @return the byte value
   */
  public byte code() {
    return (byte) code;
  }
}
