package com.codeheadsystems.fido2.service.store;

import com.codeheadsystems.fido2.api.exception.CredentialStorageException;
import com.codeheadsystems.fido2.api.model.CredentialHandle;
import com.codeheadsystems.fido2.api.model.CredentialId;
import com.codeheadsystems.fido2.api.model.PublicKeyCredentialDescriptor;
import com.codeheadsystems.fido2.api.model.RelyingPartyIdentifier;
import com.codeheadsystems.fido2.api.model.UserHandle;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStorage}.
 * <p>
 * All credentials are lost on restart. Suitable for development and testing only; replace
 * with a persistent implementation for production.
 */
public class InMemoryCredentialStorage implements CredentialStorage {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStorage.class);

  private final Map<CredentialId, Entry> records = new HashMap<>();
  // rp id -> user handle -> current discoverable credential id
  private final Map<RelyingPartyIdentifier, Map<UserHandle, CredentialId>> discoverableIndex = new HashMap<>();
  private long nextSequence;

  public InMemoryCredentialStorage() {
    log.warn("Using InMemoryCredentialStorage: credentials will NOT survive restarts. "
        + "Replace with a persistent CredentialStorage for production.");
  }

  @Override
  public synchronized void putDiscoverable(PrivateKeyCredentialSource credential) {
    if (!credential.discoverable()) {
      throw new IllegalArgumentException("Record is not marked discoverable: " + credential.id());
    }
    store(credential);
    discoverableIndex.computeIfAbsent(credential.rpId(), k -> new HashMap<>())
        .put(credential.userHandle(), credential.id());
    log.debug("Stored discoverable credential for rpId={}", credential.rpId());
  }

  @Override
  public synchronized void put(PrivateKeyCredentialSource credential) {
    if (credential.discoverable()) {
      throw new IllegalArgumentException("Record is marked discoverable: " + credential.id());
    }
    store(credential);
    log.debug("Stored non-discoverable credential for rpId={}", credential.rpId());
  }

  @Override
  public synchronized Optional<PrivateKeyCredentialSource> get(CredentialId credentialId) {
    return Optional.ofNullable(records.get(credentialId)).map(Entry::record);
  }

  @Override
  public synchronized void updateSignCount(CredentialId credentialId, long signCount) {
    Entry entry = records.get(credentialId);
    if (entry == null) {
      throw new CredentialStorageException("No credential stored with id " + credentialId);
    }
    if (signCount < entry.record().signCount()) {
      throw new CredentialStorageException("Signature counter must not decrease for " + credentialId);
    }
    records.put(credentialId, new Entry(entry.record().withSignCount(signCount), entry.sequence()));
  }

  @Override
  public synchronized boolean delete(CredentialId credentialId) {
    Entry removed = records.remove(credentialId);
    if (removed == null) {
      return false;
    }
    PrivateKeyCredentialSource record = removed.record();
    Map<UserHandle, CredentialId> byUser = discoverableIndex.get(record.rpId());
    if (byUser != null && credentialId.equals(byUser.get(record.userHandle()))) {
      Optional<Entry> previous = records.values().stream()
          .filter(entry -> entry.record().discoverable())
          .filter(entry -> entry.record().rpId().equals(record.rpId()))
          .filter(entry -> entry.record().userHandle().equals(record.userHandle()))
          .max(Comparator.comparingLong(Entry::sequence));
      if (previous.isPresent()) {
        byUser.put(record.userHandle(), previous.get().record().id());
      } else {
        byUser.remove(record.userHandle());
      }
    }
    log.debug("Deleted credential for rpId={}", record.rpId());
    return true;
  }

  @Override
  public synchronized List<CredentialHandle> listDiscoverable(RelyingPartyIdentifier rpId) {
    Map<UserHandle, CredentialId> byUser = discoverableIndex.getOrDefault(rpId, Map.of());
    return newestFirst(byUser.values().stream()
        .map(records::get)
        .filter(Objects::nonNull)
        .filter(entry -> entry.record().discoverable())
        .toList());
  }

  @Override
  public synchronized List<CredentialHandle> listSpecified(RelyingPartyIdentifier rpId,
                                                           List<PublicKeyCredentialDescriptor> credentialList) {
    Set<CredentialId> wanted = new LinkedHashSet<>();
    credentialList.forEach(descriptor -> wanted.add(descriptor.id()));
    return newestFirst(wanted.stream()
        .map(records::get)
        .filter(Objects::nonNull)
        .filter(entry -> entry.record().rpId().equals(rpId))
        .toList());
  }

  private void store(PrivateKeyCredentialSource credential) {
    Entry existing = records.get(credential.id());
    long sequence = existing == null ? nextSequence++ : existing.sequence();
    records.put(credential.id(), new Entry(credential, sequence));
  }

  private static List<CredentialHandle> newestFirst(List<Entry> entries) {
    return entries.stream()
        .sorted(Comparator.comparingLong(Entry::sequence).reversed())
        .map(entry -> entry.record().handle())
        .toList();
  }

  // Insertion sequence gives a total creation order even when clock readings tie.
  private record Entry(PrivateKeyCredentialSource record, long sequence) {
  }
}
