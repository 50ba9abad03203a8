package com.codeheadsystems.fido2.service.authenticator;

/**
 * Asks a human, or a policy, to approve an operation, and signals the device to the user.
 * <p>
 * Calls may block for as long as the interaction takes; the {@link Authenticator} never holds
 * the credential engine lock while waiting here. Failures should be thrown as
 * {@link com.codeheadsystems.fido2.api.exception.UserPresenceException}; the authenticator
 * rethrows whatever is thrown unchanged.
 */
public interface UserPresence {

  /**
   * Asks whether a new credential may be created.
   *
   * @param rpName the relying party name to show
   * @return true if approved, false if denied
   */
  boolean approveMakeCredential(String rpName);

  /**
   * Asks whether an existing credential may sign an assertion. Defaults to the same prompt as
   * {@link #approveMakeCredential(String)}.
   *
   * @param rpId the relying party id to show
   * @return true if approved, false if denied
   */
  default boolean approveGetAssertion(String rpId) {
    return approveMakeCredential(rpId);
  }

  /**
   * Signals the device to the user, e.g. by blinking an LED.
   */
  void wink();
}
