package com.codeheadsystems.fido2.api.model;

/**
 * Build version of the authenticator implementation.
 *
 * @param versionMajor  the major version
 * @param versionMinor  the minor version
 * @param versionBuild  the patch version
 * @param winkSupported whether {@code wink} does anything
 */
public record VersionInfo(int versionMajor, int versionMinor, int versionBuild, boolean winkSupported) {
}
