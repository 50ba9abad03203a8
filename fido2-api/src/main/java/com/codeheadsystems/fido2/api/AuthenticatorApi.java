package com.codeheadsystems.fido2.api;

import com.codeheadsystems.fido2.api.model.GetAssertionCommand;
import com.codeheadsystems.fido2.api.model.GetAssertionResponse;
import com.codeheadsystems.fido2.api.model.GetInfoResponse;
import com.codeheadsystems.fido2.api.model.MakeCredentialCommand;
import com.codeheadsystems.fido2.api.model.MakeCredentialResponse;
import com.codeheadsystems.fido2.api.model.VersionInfo;

/**
 * The authenticator API of CTAP 2.1 (section 6), independent of the transport that delivers
 * commands.
 * <p>
 * <strong>Exception contract</strong>: every failure is an unchecked
 * {@link com.codeheadsystems.fido2.api.exception.AuthenticatorException} whose
 * {@code statusCode()} is the CTAP status to report. Failures of storage, cryptography or the
 * presence gate arrive as their own subclasses.
 */
public interface AuthenticatorApi {

  /**
   * Build version and capability flags. Never fails.
   *
   * @return the version info
   */
  VersionInfo version();

  /**
   * authenticatorMakeCredential.
   *
   * @param command the command
   * @return the make credential response
   */
  MakeCredentialResponse makeCredential(MakeCredentialCommand command);

  /**
   * authenticatorGetAssertion.
   *
   * @param command the command
   * @return the get assertion response
   */
  GetAssertionResponse getAssertion(GetAssertionCommand command);

  /**
   * authenticatorGetInfo.
   *
   * @return the info
   */
  GetInfoResponse getInfo();

  /**
   * Asks the device to identify itself to the user, e.g. by blinking.
   */
  void wink();
}
