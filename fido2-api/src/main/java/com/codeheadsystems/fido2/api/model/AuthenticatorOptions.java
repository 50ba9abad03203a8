package com.codeheadsystems.fido2.api.model;

import java.util.Map;

/**
 * The option keys every CTAP2 authenticator must understand. Unrecognized keys in a request
 * are treated as absent.
 *
 * @param rk resident key (discoverable credential) option, null when absent
 * @param up user presence option, null when absent
 * @param uv user verification option, null when absent
 */
public record AuthenticatorOptions(Boolean rk, Boolean up, Boolean uv) {

  public static final String RESIDENT_KEY = "rk";
  public static final String USER_PRESENCE = "up";
  public static final String USER_VERIFICATION = "uv";

  /**
   * No options supplied.
   */
  public static final AuthenticatorOptions ABSENT = new AuthenticatorOptions(null, null, null);

  /**
   * Extracts the recognized keys from a request options map.
   *
   * @param options the options map, may be null
   * @return the authenticator options
   */
  public static AuthenticatorOptions from(Map<String, Boolean> options) {
    if (options == null || options.isEmpty()) {
      return ABSENT;
    }
    return new AuthenticatorOptions(
        options.get(RESIDENT_KEY),
        options.get(USER_PRESENCE),
        options.get(USER_VERIFICATION));
  }

  /**
   * Whether {@code rk} is present and true.
   *
   * @return the boolean
   */
  public boolean residentKeyRequested() {
    return Boolean.TRUE.equals(rk);
  }

  /**
   * Whether {@code uv} is present and true.
   *
   * @return the boolean
   */
  public boolean userVerificationRequested() {
    return Boolean.TRUE.equals(uv);
  }

  /**
   * The effective {@code up} value; user presence defaults to required.
   *
   * @return the boolean
   */
  public boolean userPresenceRequired() {
    return up == null || up;
  }
}
