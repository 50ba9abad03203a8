package com.codeheadsystems.fido2.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.fido2.api.exception.CredentialStorageException;
import com.codeheadsystems.fido2.api.model.CoseAlgorithmIdentifier;
import com.codeheadsystems.fido2.api.model.CredentialHandle;
import com.codeheadsystems.fido2.api.model.CredentialId;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialDescriptor;
import com.codeheadsystems.fido2.api.model.RelyingPartyIdentifier;
import com.codeheadsystems.fido2.api.model.UserHandle;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type In memory credential storage test.
 */
class InMemoryCredentialStorageTest {

  private static final RelyingPartyIdentifier RP = new RelyingPartyIdentifier("example.com");
  private static final RelyingPartyIdentifier OTHER_RP = new RelyingPartyIdentifier("other.example");
  private static final UserHandle ALICE = new UserHandle(new byte[]{1});
  private static final UserHandle BOB = new UserHandle(new byte[]{2});

  private InMemoryCredentialStorage storage;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    storage = new InMemoryCredentialStorage();
  }

  @Test
  void putDiscoverable_thenGet_returnsRecord() {
    PrivateKeyCredentialSource record = record(1, RP, ALICE, true);
    storage.putDiscoverable(record);

    assertThat(storage.get(record.id())).contains(record);
    assertThat(storage.get(record.handle())).contains(record);
  }

  @Test
  void get_unknown_returnsEmpty() {
    assertThat(storage.get(new CredentialId(new byte[]{42}))).isEmpty();
  }

  @Test
  void putDiscoverable_nonDiscoverableRecord_rejected() {
    assertThatThrownBy(() -> storage.putDiscoverable(record(1, RP, ALICE, false)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void put_discoverableRecord_rejected() {
    assertThatThrownBy(() -> storage.put(record(1, RP, ALICE, true)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void putDiscoverable_sameId_isIdempotent() {
    PrivateKeyCredentialSource record = record(1, RP, ALICE, true);
    storage.putDiscoverable(record);
    storage.putDiscoverable(record);

    assertThat(storage.listDiscoverable(RP)).hasSize(1);
  }

  @Test
  void listDiscoverable_newerCredentialForSameUser_replacesIndexEntry() {
    PrivateKeyCredentialSource older = record(1, RP, ALICE, true);
    PrivateKeyCredentialSource newer = record(2, RP, ALICE, true);
    storage.putDiscoverable(older);
    storage.putDiscoverable(newer);

    assertThat(storage.listDiscoverable(RP)).extracting(CredentialHandle::credentialId).containsExactly(newer.id());
    // The replaced record is still reachable by id.
    assertThat(storage.get(older.id())).isPresent();
  }

  @Test
  void listDiscoverable_multipleUsers_newestFirst() {
    storage.putDiscoverable(record(1, RP, ALICE, true));
    storage.putDiscoverable(record(2, RP, BOB, true));
    storage.putDiscoverable(record(3, OTHER_RP, ALICE, true));

    assertThat(storage.listDiscoverable(RP)).extracting(CredentialHandle::credentialId)
        .containsExactly(id(2), id(1));
  }

  @Test
  void listDiscoverable_excludesNonDiscoverable() {
    storage.put(record(1, RP, ALICE, false));

    assertThat(storage.listDiscoverable(RP)).isEmpty();
  }

  @Test
  void listSpecified_filtersByRelyingPartyAndExistence() {
    storage.putDiscoverable(record(1, RP, ALICE, true));
    storage.put(record(2, RP, BOB, false));
    storage.putDiscoverable(record(3, OTHER_RP, ALICE, true));

    List<CredentialHandle> handles = storage.listSpecified(RP, List.of(
        PublicKeyCredentialDescriptor.publicKey(id(1)),
        PublicKeyCredentialDescriptor.publicKey(id(2)),
        PublicKeyCredentialDescriptor.publicKey(id(3)),
        PublicKeyCredentialDescriptor.publicKey(id(9)),
        PublicKeyCredentialDescriptor.publicKey(id(1))));

    assertThat(handles).extracting(CredentialHandle::credentialId).containsExactly(id(2), id(1));
  }

  @Test
  void updateSignCount_persistsNewValue() {
    storage.putDiscoverable(record(1, RP, ALICE, true));

    storage.updateSignCount(id(1), 5L);

    assertThat(storage.get(id(1))).hasValueSatisfying(r -> assertThat(r.signCount()).isEqualTo(5L));
  }

  @Test
  void updateSignCount_decrease_rejected() {
    storage.putDiscoverable(record(1, RP, ALICE, true));
    storage.updateSignCount(id(1), 5L);

    assertThatThrownBy(() -> storage.updateSignCount(id(1), 4L))
        .isInstanceOf(CredentialStorageException.class);
  }

  @Test
  void updateSignCount_unknownId_rejected() {
    assertThatThrownBy(() -> storage.updateSignCount(id(7), 1L))
        .isInstanceOf(CredentialStorageException.class);
  }

  @Test
  void delete_indexedCredential_fallsBackToPreviousForSameUser() {
    PrivateKeyCredentialSource older = record(1, RP, ALICE, true);
    PrivateKeyCredentialSource newer = record(2, RP, ALICE, true);
    storage.putDiscoverable(older);
    storage.putDiscoverable(newer);

    assertThat(storage.delete(newer.id())).isTrue();

    assertThat(storage.get(newer.id())).isEmpty();
    assertThat(storage.listDiscoverable(RP)).containsExactly(older.handle());
  }

  @Test
  void delete_onlyCredential_leavesRelyingPartyEmpty() {
    PrivateKeyCredentialSource record = record(1, RP, ALICE, true);
    storage.putDiscoverable(record);

    assertThat(storage.delete(record.id())).isTrue();

    assertThat(storage.listDiscoverable(RP)).isEmpty();
    assertThat(storage.listSpecified(RP, List.of(record.handle().descriptor()))).isEmpty();
  }

  @Test
  void delete_unknownId_returnsFalse() {
    storage.putDiscoverable(record(1, RP, ALICE, true));

    assertThat(storage.delete(id(9))).isFalse();
    assertThat(storage.listDiscoverable(RP)).hasSize(1);
  }

  private static CredentialId id(int value) {
    byte[] bytes = new byte[16];
    bytes[15] = (byte) value;
    return new CredentialId(bytes);
  }

  private static PrivateKeyCredentialSource record(int id, RelyingPartyIdentifier rp, UserHandle user,
                                                   boolean discoverable) {
    return new PrivateKeyCredentialSource(CoseAlgorithmIdentifier.ES256, id(id), rp, user,
        new byte[]{0x30, 0x00}, discoverable, 0L, Instant.parse("2024-01-01T00:00:00Z"));
  }
}
