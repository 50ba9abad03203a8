package com.codeheadsystems.fido2.service.authenticator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.fido2.api.exception.AuthenticatorException;
import com.codeheadsystems.fido2.api.exception.CredentialStorageException;
import com.codeheadsystems.fido2.api.exception.CtapStatusCode;
import com.codeheadsystems.fido2.api.model.Aaguid;
import com.codeheadsystems.fido2.api.model.AttestedCredentialData;
import com.codeheadsystems.fido2.api.model.AuthenticatorData;
import com.codeheadsystems.fido2.api.model.CoseKey;
import com.codeheadsystems.fido2.api.model.CredentialHandle;
import com.codeheadsystems.fido2.api.model.CredentialId;
import com.codeheadsystems.fido2.api.model.GetAssertionCommand;
import com.codeheadsystems.fido2.api.model.MakeCredentialCommand;
import com.codeheadsystems.fido2.api.model.PackedAttestationStatement;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialDescriptor;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialParameters;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialRpEntity;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialUserEntity;
import com.codeheadsystems.fido2.api.model.RelyingPartyIdentifier;
import com.codeheadsystems.fido2.api.model.Sha256;
import com.codeheadsystems.fido2.api.model.Signature;
import com.codeheadsystems.fido2.api.model.UserHandle;
import com.codeheadsystems.fido2.service.config.AuthenticatorConfig;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Checks that the orchestrator consults the presence gate before the secret store and never
 * touches the store on a rejected request.
 */
@ExtendWith(MockitoExtension.class)
class AuthenticatorOrderingTest {

  private static final RelyingPartyIdentifier RP_ID = new RelyingPartyIdentifier("example.com");
  private static final UserHandle USER_HANDLE = new UserHandle(new byte[]{0x01});
  private static final Sha256 CLIENT_DATA_HASH = Sha256.digest(new byte[]{1, 2, 3});
  private static final CredentialHandle HANDLE = new CredentialHandle(
      PublicKeyCredentialDescriptor.publicKey(new CredentialId(new byte[16])), RP_ID, USER_HANDLE);

  @Mock private SecretStore secretStore;
  @Mock private UserPresence userPresence;

  private Authenticator authenticator;

  @BeforeEach
  void setUp() {
    authenticator = new Authenticator(secretStore, userPresence, AuthenticatorConfig.forTesting());
  }

  @Test
  void makeCredential_promptsBeforeCreatingThenAttests() {
    when(userPresence.approveMakeCredential("Example")).thenReturn(true);
    when(secretStore.makeCredential(PublicKeyCredentialParameters.es256(), RP_ID, USER_HANDLE, true))
        .thenReturn(HANDLE);
    when(secretStore.attest(RP_ID, HANDLE, CLIENT_DATA_HASH, true, false)).thenReturn(attestation());

    authenticator.makeCredential(command(null, null));

    InOrder order = inOrder(userPresence, secretStore);
    order.verify(userPresence).approveMakeCredential("Example");
    order.verify(secretStore).makeCredential(PublicKeyCredentialParameters.es256(), RP_ID, USER_HANDLE, true);
    order.verify(secretStore).attest(RP_ID, HANDLE, CLIENT_DATA_HASH, true, false);
  }

  @Test
  void makeCredential_rejected_neverTouchesStoreOrGate() {
    assertThatThrownBy(() -> authenticator.makeCredential(command(Map.of("uv", true), null)))
        .isInstanceOf(AuthenticatorException.class);
    assertThatThrownBy(() -> authenticator.makeCredential(command(null, 1)))
        .isInstanceOf(AuthenticatorException.class);

    verifyNoInteractions(secretStore, userPresence);
  }

  @Test
  void makeCredential_storageFailure_propagatesUnchanged() {
    CredentialStorageException failure = new CredentialStorageException("disk full");
    when(userPresence.approveMakeCredential("Example")).thenReturn(true);
    when(secretStore.makeCredential(any(), eq(RP_ID), eq(USER_HANDLE), anyBoolean())).thenThrow(failure);

    assertThatThrownBy(() -> authenticator.makeCredential(command(null, null)))
        .isSameAs(failure)
        .satisfies(e -> assertThat(((AuthenticatorException) e).statusCode()).isEqualTo(CtapStatusCode.OTHER));
  }

  @Test
  void getAssertion_listsBeforePromptingThenAsserts() {
    when(secretStore.listDiscoverableCredentials(RP_ID)).thenReturn(List.of(HANDLE));
    when(userPresence.approveGetAssertion("example.com")).thenReturn(true);
    when(secretStore.assertCredential(RP_ID, HANDLE, CLIENT_DATA_HASH, true, false))
        .thenReturn(new AssertionResult(
            new AuthenticatorData(RP_ID.hash(), true, false, 7L, null), new Signature(new byte[]{0x30})));

    authenticator.getAssertion(new GetAssertionCommand(RP_ID, CLIENT_DATA_HASH));

    InOrder order = inOrder(userPresence, secretStore);
    order.verify(secretStore).listDiscoverableCredentials(RP_ID);
    order.verify(userPresence).approveGetAssertion("example.com");
    order.verify(secretStore).assertCredential(RP_ID, HANDLE, CLIENT_DATA_HASH, true, false);
  }

  @Test
  void getAssertion_emptyAllowList_fallsBackToDiscoverable() {
    when(secretStore.listDiscoverableCredentials(RP_ID)).thenReturn(List.of());

    assertThatThrownBy(() -> authenticator.getAssertion(
        new GetAssertionCommand(RP_ID, CLIENT_DATA_HASH, List.of())))
        .isInstanceOf(AuthenticatorException.class)
        .satisfies(e -> assertThat(((AuthenticatorException) e).statusCode())
            .isEqualTo(CtapStatusCode.NO_CREDENTIALS));
    verifyNoInteractions(userPresence);
  }

  private static MakeCredentialCommand command(Map<String, Boolean> options, Integer enterpriseAttestation) {
    return new MakeCredentialCommand(CLIENT_DATA_HASH,
        new PublicKeyCredentialRpEntity(RP_ID, "Example"),
        PublicKeyCredentialUserEntity.idOnly(USER_HANDLE),
        List.of(PublicKeyCredentialParameters.es256()),
        null, null, options, null, null, enterpriseAttestation);
  }

  private static AttestationResult attestation() {
    AuthenticatorData authData = new AuthenticatorData(RP_ID.hash(), true, false, 1L,
        new AttestedCredentialData(Aaguid.ZERO, HANDLE.credentialId(),
            new CoseKey(-7, new byte[32], new byte[32])));
    return new AttestationResult(authData,
        new PackedAttestationStatement(-7, new Signature(new byte[]{0x30}), null));
  }
}
