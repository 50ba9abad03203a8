package com.codeheadsystems.fido2.api.model;

/**
 * WebAuthn credential types.
 */
public enum PublicKeyCredentialType {

  PUBLIC_KEY("public-key");

  private final String value;

  PublicKeyCredentialType(String value) {
    this.value = value;
  }

  /**
   * The wire value.
   *
   * @return the string
   */
  public String value() {
    return value;
  }
}
