package com.codeheadsystems.fido2.service.presence;

import com.codeheadsystems.fido2.service.authenticator.UserPresence;
import java.util.concurrent.atomic.AtomicLong;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Presence gate that approves every request without asking anyone. Intended for unattended
 * test rigs; never use it in front of real relying parties.
 */
@Singleton
public class AutoApproveUserPresence implements UserPresence {

  private static final Logger log = LoggerFactory.getLogger(AutoApproveUserPresence.class);

  private final AtomicLong approvals = new AtomicLong();
  private final AtomicLong winks = new AtomicLong();

  /**
   * Instantiates a new Auto approve user presence.
   */
  public AutoApproveUserPresence() {
    log.warn("AutoApproveUserPresence: every request is approved without user interaction.");
  }

  @Override
  public boolean approveMakeCredential(final String rpName) {
    log.info("Auto-approving credential creation for {}", rpName);
    approvals.incrementAndGet();
    return true;
  }

  @Override
  public boolean approveGetAssertion(final String rpId) {
    log.info("Auto-approving assertion for {}", rpId);
    approvals.incrementAndGet();
    return true;
  }

  @Override
  public void wink() {
    log.info("wink");
    winks.incrementAndGet();
  }

  /**
   * Number of approvals granted so far.
   *
   * @return the long
   */
  public long approvals() {
    return approvals.get();
  }

  /**
   * Number of winks received so far.
   *
   * @return the long
   */
  public long winks() {
    return winks.get();
  }
}
