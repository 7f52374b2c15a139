package com.codeheadsystems.portal.server.vault;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import com.codeheadsystems.portal.server.role.Role;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the portal's credential-store token and signs certificates with it.
 * <p>
 * The token lives in an {@link AtomicReference}: signers load it once per call and renewal swaps
 * in a complete new {@link ServiceCredential}, so no signer sees a half-replaced credential and an
 * expired one is never presented. Renewal, retries and re-login all run on one named thread, which
 * is the only writer.
 * <p>
 * Renewal starts at {@code renewFraction} of the lease. Failures back off exponentially from
 * {@code initialBackoff} to {@code maxBackoff}; after {@code maxRenewAttempts} failures, or for a
 * non-renewable token, the client logs in afresh. Without a valid token the client is degraded and
 * signing fails with {@link ErrorCode#UPSTREAM_UNAVAILABLE} until a login succeeds.
 */
public class VaultCredentialStoreClient implements CertificateSigner {

  private static final Logger log = LoggerFactory.getLogger(VaultCredentialStoreClient.class);

  private final VaultAccessor accessor;
  private final VaultSettings settings;
  private final Supplier<String> platformToken;
  private final Clock clock;
  private final AtomicReference<ServiceCredential> credential = new AtomicReference<>();
  private final ScheduledExecutorService renewer;

  // Touched only on the renewal thread once started.
  private ScheduledFuture<?> next;
  private int failedRenewals;
  private Duration backoff;

  /**
   * Instantiates a new Vault credential store client.
   *
   * @param accessor      the accessor
   * @param settings      the settings
   * @param platformToken supplies the workload identity token at each login
   * @param clock         the clock
   */
  public VaultCredentialStoreClient(final VaultAccessor accessor,
                                    final VaultSettings settings,
                                    final Supplier<String> platformToken,
                                    final Clock clock) {
    this.accessor = accessor;
    this.settings = settings;
    this.platformToken = platformToken;
    this.clock = clock;
    this.backoff = settings.initialBackoff();
    this.renewer = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "credential-store-renewal"));
  }

  // ── Lifecycle ─────────────────────────────────────────────────────────────

  /**
   * Logs in and starts the renewal loop. A failed login leaves the client degraded and retrying;
   * it does not abort startup.
   */
  public void start() {
    await(renewer.submit(this::login));
  }

  /**
   * Stops the renewal loop, waits for its thread, then revokes the token best-effort.
   */
  public void stop() {
    renewer.shutdownNow();
    try {
      if (!renewer.awaitTermination(settings.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("credential-store-renewal did not stop within {}", settings.stopTimeout());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    ServiceCredential last = credential.getAndSet(null);
    if (last != null && last.isValidAt(clock.instant())) {
      try {
        accessor.revokeSelf(last.token());
        log.info("Credential store token revoked");
      } catch (PortalException e) {
        log.warn("Token revocation at shutdown failed: {}", e.getMessage());
      }
    }
  }

  // ── Signing ───────────────────────────────────────────────────────────────

  @Override
  public SignedCertificate sign(final Role role,
                                final String publicKey,
                                final List<String> validPrincipals,
                                final Duration ttl,
                                final String keyId) {
    ServiceCredential current = currentCredential();
    return accessor.sign(current.token(), role.signingRole(), publicKey, validPrincipals, ttl, keyId);
  }

  @Override
  public String caPublicKey() {
    return accessor.caPublicKey();
  }

  @Override
  public boolean isAvailable() {
    ServiceCredential current = credential.get();
    return current != null && current.isValidAt(clock.instant());
  }

  /**
   * The credential to present now.
   *
   * @return a valid credential
   * @throws PortalException {@link ErrorCode#UPSTREAM_UNAVAILABLE} while degraded
   */
  ServiceCredential currentCredential() {
    ServiceCredential current = credential.get();
    if (current == null || !current.isValidAt(clock.instant())) {
      throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "credential store access is degraded");
    }
    return current;
  }

  /**
   * Runs one renewal step now on the renewal thread and waits for it.
   */
  void renewNow() {
    await(renewer.submit(this::renew));
  }

  // ── Renewal loop (renewal thread only) ────────────────────────────────────

  private void renew() {
    ServiceCredential current = credential.get();
    if (current == null || !current.renewable() || !current.isValidAt(clock.instant())) {
      login();
      return;
    }
    try {
      ServiceCredential renewed = accessor.renewSelf(current.token());
      credential.set(renewed);
      log.debug("Credential renewed, lease={}", renewed.leaseDuration());
      succeeded(renewed);
    } catch (PortalException e) {
      failedRenewals++;
      dropIfExpired(current);
      if (failedRenewals >= settings.maxRenewAttempts()) {
        log.warn("Renewal failed {} times, logging in again: {}", failedRenewals, e.getMessage());
        failedRenewals = 0;
        login();
      } else {
        Duration delay = nextBackoff();
        log.warn("Renewal attempt {} failed, retrying in {}: {}", failedRenewals, delay, e.getMessage());
        schedule(this::renew, delay);
      }
    }
  }

  private void login() {
    try {
      ServiceCredential fresh = accessor.login(platformToken.get());
      credential.set(fresh);
      log.info("Logged in to credential store, lease={}", fresh.leaseDuration());
      succeeded(fresh);
    } catch (PortalException e) {
      ServiceCredential current = credential.get();
      if (current != null) {
        dropIfExpired(current);
      }
      Duration delay = nextBackoff();
      log.warn("Credential store login failed{}, retrying in {}: {}",
          isAvailable() ? "" : " (degraded)", delay, e.getMessage());
      schedule(this::login, delay);
    }
  }

  private void succeeded(final ServiceCredential fresh) {
    failedRenewals = 0;
    backoff = settings.initialBackoff();
    Duration delay = Duration.between(clock.instant(), fresh.renewalDeadline(settings.renewFraction()));
    schedule(this::renew, delay.isNegative() ? Duration.ZERO : delay);
  }

  private void dropIfExpired(final ServiceCredential current) {
    if (!current.isValidAt(clock.instant()) && credential.compareAndSet(current, null)) {
      log.warn("Credential store token expired at {}; signing is unavailable", current.expiresAt());
    }
  }

  private Duration nextBackoff() {
    Duration delay = backoff;
    Duration doubled = backoff.multipliedBy(2);
    backoff = doubled.compareTo(settings.maxBackoff()) > 0 ? settings.maxBackoff() : doubled;
    return delay;
  }

  private void schedule(final Runnable step, final Duration delay) {
    if (next != null) {
      next.cancel(false);
    }
    try {
      next = renewer.schedule(step, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("Renewal loop stopped, not rescheduling");
    }
  }

  private static void await(final Future<?> future) {
    try {
      future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      throw new IllegalStateException("credential store renewal step failed", e.getCause());
    }
  }

  /**
   * When the current credential expires, for health reporting.
   *
   * @return the expiry, or null while degraded
   */
  public Instant credentialExpiry() {
    ServiceCredential current = credential.get();
    return current == null ? null : current.expiresAt();
  }
}
