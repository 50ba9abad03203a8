package com.codeheadsystems.fido2.service.authenticator;

import com.codeheadsystems.fido2.api.AuthenticatorApi;
import com.codeheadsystems.fido2.api.exception.AuthenticatorException;
import com.codeheadsystems.fido2.api.exception.CtapStatusCode;
import com.codeheadsystems.fido2.api.model.AuthenticatorOptions;
import com.codeheadsystems.fido2.api.model.CredentialHandle;
import com.codeheadsystems.fido2.api.model.GetAssertionCommand;
import com.codeheadsystems.fido2.api.model.GetAssertionResponse;
import com.codeheadsystems.fido2.api.model.GetInfoResponse;
import com.codeheadsystems.fido2.api.model.MakeCredentialCommand;
import com.codeheadsystems.fido2.api.model.MakeCredentialResponse;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialParameters;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialRpEntity;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialUserEntity;
import com.codeheadsystems.fido2.api.model.VersionInfo;
import com.codeheadsystems.fido2.service.config.AuthenticatorConfig;
import com.codeheadsystems.fido2.service.config.BuildVersion;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CTAP2 protocol orchestrator. Validates each request, obtains user presence and drives the
 * {@link SecretStore}.
 * <p>
 * Approval is always obtained before the secret store is called, so the store's lock is
 * never held while a user is being prompted. A rejected request leaves storage untouched.
 * <p>
 * Exception contract: protocol rejections are thrown as {@link AuthenticatorException} with
 * the matching {@link CtapStatusCode}; exceptions from the secret store and the presence gate
 * are rethrown unchanged.
 */
@Singleton
public class Authenticator implements AuthenticatorApi {

  public static final String FIDO_2_1 = "FIDO_2_1";
  public static final String U2F_V2 = "U2F_V2";
  public static final String PLATFORM_DEVICE = "plat";

  private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

  private final SecretStore secretStore;
  private final UserPresence userPresence;
  private final AuthenticatorConfig config;
  private final VersionInfo versionInfo;

  /**
   * Instantiates a new Authenticator.
   *
   * @param secretStore  the secret store
   * @param userPresence the user presence
   * @param config       the config
   */
  @Inject
  public Authenticator(final SecretStore secretStore,
                       final UserPresence userPresence,
                       final AuthenticatorConfig config) {
    this.secretStore = secretStore;
    this.userPresence = userPresence;
    this.config = config;
    this.versionInfo = BuildVersion.load(true);
    log.info("Authenticator(aaguid={}, version={}.{}.{})", config.aaguid(),
        versionInfo.versionMajor(), versionInfo.versionMinor(), versionInfo.versionBuild());
  }

  @Override
  public VersionInfo version() {
    log.debug("version()");
    return versionInfo;
  }

  @Override
  public MakeCredentialResponse makeCredential(final MakeCredentialCommand command) {
    log.debug("makeCredential(rp={})", command.rp() == null ? null : command.rp().id());
    requirePresent(command.clientDataHash(), "clientDataHash");
    PublicKeyCredentialRpEntity rp = requirePresent(command.rp(), "rp");
    PublicKeyCredentialUserEntity user = requirePresent(command.user(), "user");
    requirePresent(user.id(), "user.id");
    requirePresent(command.pubKeyCredParams(), "pubKeyCredParams");
    if (command.pubKeyCredParams().stream().anyMatch(Objects::isNull)) {
      throw new AuthenticatorException(CtapStatusCode.MISSING_PARAMETER, "pubKeyCredParams contains a null entry");
    }

    if (command.pinUvAuthParam() != null) {
      throw new AuthenticatorException(CtapStatusCode.INVALID_PARAMETER, "pinUvAuthParam is not supported");
    }
    PublicKeyCredentialParameters parameters = command.pubKeyCredParams().stream()
        .filter(PublicKeyCredentialParameters::isEs256)
        .findFirst()
        .orElseThrow(() -> new AuthenticatorException(CtapStatusCode.UNSUPPORTED_ALGORITHM,
            "No supported algorithm in pubKeyCredParams"));
    boolean userPresent = false;
    boolean userVerified = false;

    AuthenticatorOptions options = AuthenticatorOptions.from(command.options());
    if (options.userVerificationRequested()) {
      throw new AuthenticatorException(CtapStatusCode.INVALID_OPTION, "User verification is not supported");
    }
    if (Boolean.FALSE.equals(options.up())) {
      throw new AuthenticatorException(CtapStatusCode.INVALID_OPTION, "up=false is not allowed for makeCredential");
    }
    // Credentials are discoverable unless the platform explicitly opts out.
    boolean discoverable = options.rk() == null || options.rk();

    if (command.enterpriseAttestation() != null) {
      throw new AuthenticatorException(CtapStatusCode.INVALID_PARAMETER, "Enterprise attestation is not supported");
    }
    if (command.excludeList() != null) {
      throw new AuthenticatorException(CtapStatusCode.INVALID_PARAMETER, "excludeList is not supported");
    }

    String rpName = rp.name() == null || rp.name().isBlank() ? rp.id().id() : rp.name();
    if (!userPresence.approveMakeCredential(rpName)) {
      throw new AuthenticatorException(CtapStatusCode.OPERATION_DENIED, "User denied credential creation");
    }
    userPresent = true;

    CredentialHandle handle = secretStore.makeCredential(parameters, rp.id(), user.id(), discoverable);
    AttestationResult result = secretStore.attest(rp.id(), handle, command.clientDataHash(), userPresent, userVerified);
    return new MakeCredentialResponse(result.authData(), result.attStmt());
  }

  /**
   * Signs an assertion with the newest matching credential.
   * <p>
   * The presence gate is consulted unless the platform sends {@code up=false}; such silent
   * assertions follow CTAP 2.1 and are reported with the UP flag cleared. This differs from
   * makeCredential, where {@code up=false} is rejected.
   *
   * @param command the command
   * @return the response
   */
  @Override
  public GetAssertionResponse getAssertion(final GetAssertionCommand command) {
    log.debug("getAssertion(rpId={})", command.rpId());
    requirePresent(command.rpId(), "rpId");
    requirePresent(command.clientDataHash(), "clientDataHash");

    if (command.pinUvAuthParam() != null) {
      throw new AuthenticatorException(CtapStatusCode.INVALID_PARAMETER, "pinUvAuthParam is not supported");
    }
    AuthenticatorOptions options = AuthenticatorOptions.from(command.options());
    if (options.userVerificationRequested()) {
      throw new AuthenticatorException(CtapStatusCode.INVALID_OPTION, "User verification is not supported");
    }
    if (options.rk() != null) {
      throw new AuthenticatorException(CtapStatusCode.UNSUPPORTED_OPTION, "rk is not valid for getAssertion");
    }
    boolean userPresent = options.userPresenceRequired();

    boolean discoverableLookup = command.allowList() == null || command.allowList().isEmpty();
    List<CredentialHandle> credentials = discoverableLookup
        ? secretStore.listDiscoverableCredentials(command.rpId())
        : secretStore.listSpecifiedCredentials(command.rpId(), command.allowList());
    if (credentials.isEmpty()) {
      throw new AuthenticatorException(CtapStatusCode.NO_CREDENTIALS, "No credentials for " + command.rpId());
    }

    if (userPresent && !userPresence.approveGetAssertion(command.rpId().id())) {
      throw new AuthenticatorException(CtapStatusCode.OPERATION_DENIED, "User denied assertion");
    }

    CredentialHandle selected = credentials.get(0);
    AssertionResult result = secretStore.assertCredential(
        command.rpId(), selected, command.clientDataHash(), userPresent, false);
    return new GetAssertionResponse(
        selected.descriptor(),
        result.authData(),
        result.signature(),
        discoverableLookup ? PublicKeyCredentialUserEntity.idOnly(selected.userHandle()) : null,
        discoverableLookup ? credentials.size() : null);
  }

  @Override
  public GetInfoResponse getInfo() {
    log.debug("getInfo()");
    Map<String, Boolean> options = new LinkedHashMap<>();
    options.put(AuthenticatorOptions.RESIDENT_KEY, true);
    options.put(AuthenticatorOptions.USER_PRESENCE, true);
    options.put(PLATFORM_DEVICE, false);
    return new GetInfoResponse(
        List.of(FIDO_2_1, U2F_V2),
        config.aaguid(),
        options,
        List.of(PublicKeyCredentialParameters.es256()),
        0);
  }

  @Override
  public void wink() {
    log.debug("wink()");
    userPresence.wink();
  }

  private static <T> T requirePresent(final T value, final String name) {
    if (value == null) {
      throw new AuthenticatorException(CtapStatusCode.MISSING_PARAMETER, name + " is required");
    }
    return value;
  }
}
