package com.codeheadsystems.portal.server.auth;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches the identity provider's token signing keys.
 * <p>
 * Readers see an immutable snapshot through a volatile field and never block on each other.
 * Refreshes are serialised on a lock: a background task refreshes every TTL, an expired snapshot
 * or an unknown key id triggers an on-demand refresh at most once per {@code minRefreshInterval}.
 * When the provider is unreachable the last good snapshot keeps being served until it is older
 * than {@code maxStaleness}; after that lookups fail with {@link ErrorCode#UPSTREAM_UNAVAILABLE}.
 */
public class SigningKeyCache {

  private static final Logger log = LoggerFactory.getLogger(SigningKeyCache.class);

  private final KeySetSource source;
  private final Clock clock;
  private final Duration ttl;
  private final Duration maxStaleness;
  private final Duration minRefreshInterval;
  private final Object refreshLock = new Object();
  private final ScheduledExecutorService refresher;

  private volatile Snapshot snapshot;
  private volatile Instant lastAttempt = Instant.EPOCH;

  /**
   * Instantiates a new Signing key cache.
   *
   * @param source             the key source
   * @param clock              the clock
   * @param ttl                freshness of a fetched key set
   * @param maxStaleness       how long a key set may be served when refreshes fail
   * @param minRefreshInterval minimum spacing of on-demand refreshes
   */
  public SigningKeyCache(final KeySetSource source,
                         final Clock clock,
                         final Duration ttl,
                         final Duration maxStaleness,
                         final Duration minRefreshInterval) {
    this.source = source;
    this.clock = clock;
    this.ttl = ttl;
    this.maxStaleness = maxStaleness;
    this.minRefreshInterval = minRefreshInterval;
    this.refresher = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "signing-key-refresh");
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Loads the key set and schedules the periodic refresh. A failed first load is logged; the
   * cache then loads on demand.
   */
  public void start() {
    try {
      refresh();
    } catch (PortalException e) {
      log.warn("Initial signing key fetch failed, continuing without keys: {}", e.getMessage());
    }
    long period = ttl.toMillis();
    refresher.scheduleWithFixedDelay(this::refreshInBackground, period, period, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops the periodic refresh and waits briefly for a running refresh to finish.
   */
  public void stop() {
    refresher.shutdownNow();
    try {
      if (!refresher.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("signing-key-refresh did not stop within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * The public key for a token's {@code kid}. A token without a {@code kid} is accepted only when
   * the provider publishes exactly one key.
   *
   * @param keyId the key id, may be null
   * @return the key
   * @throws PortalException {@code UNAUTHENTICATED} for an unknown key,
   *                         {@code UPSTREAM_UNAVAILABLE} when no usable key set exists
   */
  public RSAPublicKey publicKey(final String keyId) {
    Snapshot current = usableSnapshot();
    RSAPublicKey key = lookup(current, keyId);
    if (key == null && keyId != null && refreshAllowed()) {
      log.info("Unknown signing key {}, refreshing key set", keyId);
      key = lookup(refreshOrKeep(current), keyId);
    }
    if (key == null) {
      throw new PortalException(ErrorCode.UNAUTHENTICATED, "token signed by an unknown key");
    }
    return key;
  }

  /**
   * Whether a key set is loaded and not older than the staleness bound.
   *
   * @return true when tokens can be validated
   */
  public boolean isUsable() {
    Snapshot current = snapshot;
    return current != null && !current.olderThan(maxStaleness, clock.instant());
  }

  /**
   * When the key set was last fetched successfully.
   *
   * @return the time, empty before the first success
   */
  public Optional<Instant> lastSuccessfulFetch() {
    return Optional.ofNullable(snapshot).map(Snapshot::fetchedAt);
  }

  private Snapshot usableSnapshot() {
    Snapshot current = snapshot;
    Instant now = clock.instant();
    if (current != null && !current.olderThan(ttl, now)) {
      return current;
    }
    if (refreshAllowed()) {
      Snapshot refreshed = refreshOrKeep(current);
      if (refreshed != null && refreshed != current) {
        return refreshed;
      }
    }
    if (current != null && !current.olderThan(maxStaleness, now)) {
      return current;
    }
    throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "token signing keys are unavailable");
  }

  private Snapshot refreshOrKeep(final Snapshot current) {
    try {
      return refreshUnlessReplaced(current);
    } catch (PortalException e) {
      log.warn("Signing key refresh failed: {}", e.getMessage());
      return current;
    }
  }

  private void refreshInBackground() {
    try {
      refresh();
    } catch (PortalException e) {
      log.warn("Scheduled signing key refresh failed: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.error("Scheduled signing key refresh failed unexpectedly", e);
    }
  }

  private boolean refreshAllowed() {
    return !lastAttempt.plus(minRefreshInterval).isAfter(clock.instant());
  }

  /**
   * Refreshes unless another thread replaced {@code seen} while this one waited for the lock.
   */
  private Snapshot refreshUnlessReplaced(final Snapshot seen) {
    synchronized (refreshLock) {
      Snapshot current = snapshot;
      if (current != seen && current != null) {
        log.debug("Key set was refreshed while waiting, reusing it");
        return current;
      }
      return refresh();
    }
  }

  private Snapshot refresh() {
    synchronized (refreshLock) {
      lastAttempt = clock.instant();
      Map<String, RSAPublicKey> keys = source.fetchSigningKeys();
      if (keys.isEmpty()) {
        throw new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "identity provider published no signing keys");
      }
      Snapshot fresh = new Snapshot(Map.copyOf(keys), clock.instant());
      snapshot = fresh;
      log.debug("refresh() -> kids={}", keys.keySet());
      return fresh;
    }
  }

  private static RSAPublicKey lookup(final Snapshot snapshot, final String keyId) {
    if (snapshot == null) {
      return null;
    }
    if (keyId == null) {
      return snapshot.keys().size() == 1 ? snapshot.keys().values().iterator().next() : null;
    }
    return snapshot.keys().get(keyId);
  }

  private record Snapshot(Map<String, RSAPublicKey> keys, Instant fetchedAt) {

    boolean olderThan(final Duration age, final Instant now) {
      return !fetchedAt.plus(age).isAfter(now);
    }
  }
}
