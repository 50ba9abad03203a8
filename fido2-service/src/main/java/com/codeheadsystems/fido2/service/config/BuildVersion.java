package com.codeheadsystems.fido2.service.config;

import com.codeheadsystems.fido2.api.model.VersionInfo;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Build metadata written into {@value #RESOURCE} by Maven resource filtering.
 */
public class BuildVersion {

  public static final String RESOURCE = "/fido2-authenticator.properties";
  public static final String VERSION_PROPERTY = "version";

  private static final Logger log = LoggerFactory.getLogger(BuildVersion.class);
  private static final Pattern SEMVER = Pattern.compile("^(\\d+)\\.(\\d+)(?:\\.(\\d+))?.*$");

  private BuildVersion() {
  }

  /**
   * Loads the version of the running build. Falls back to 0.0.0 when the resource is missing
   * or unreadable so that callers never see a failure.
   *
   * @param winkSupported whether the presence gate supports wink
   * @return the version info
   */
  public static VersionInfo load(boolean winkSupported) {
    Properties properties = new Properties();
    try (InputStream in = BuildVersion.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.warn("Build metadata {} not found; reporting version 0.0.0", RESOURCE);
        return new VersionInfo(0, 0, 0, winkSupported);
      }
      properties.load(in);
    } catch (IOException e) {
      log.warn("Unable to read build metadata {}; reporting version 0.0.0", RESOURCE, e);
      return new VersionInfo(0, 0, 0, winkSupported);
    }
    return parse(properties.getProperty(VERSION_PROPERTY, ""), winkSupported);
  }

  /**
   * Parses a {@code major.minor[.patch][-qualifier]} version string.
   *
   * @param version       the version
   * @param winkSupported the wink supported
   * @return the version info, 0.0.0 if unparseable
   */
  public static VersionInfo parse(String version, boolean winkSupported) {
    Matcher matcher = SEMVER.matcher(version == null ? "" : version.trim());
    if (!matcher.matches()) {
      log.warn("Unparseable build version '{}'; reporting version 0.0.0", version);
      return new VersionInfo(0, 0, 0, winkSupported);
    }
    try {
      return new VersionInfo(
          Integer.parseInt(matcher.group(1)),
          Integer.parseInt(matcher.group(2)),
          matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3)),
          winkSupported);
    } catch (NumberFormatException e) {
      log.warn("Unparseable build version '{}'; reporting version 0.0.0", version, e);
      return new VersionInfo(0, 0, 0, winkSupported);
    }
  }
}
