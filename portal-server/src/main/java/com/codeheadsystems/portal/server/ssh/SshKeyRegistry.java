package com.codeheadsystems.portal.server.ssh;

import com.codeheadsystems.portal.model.directory.UserResponse;
import com.codeheadsystems.portal.model.ssh.RegisteredSshKeyResponse;
import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.directory.DirectoryAccessor;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The SSH public key each user registered, kept as attributes of their directory account.
 * <p>
 * Once a user has registered a key, certificates are only issued for that key. Users without a
 * registered key, or without a directory account, may have any acceptable key signed.
 */
@Singleton
public class SshKeyRegistry {

  /** Directory attribute holding the registered key line. */
  public static final String KEY_ATTRIBUTE = "ssh_public_key";
  /** Directory attribute holding the registration time, ISO-8601. */
  public static final String REGISTERED_AT_ATTRIBUTE = "ssh_key_registered_at";

  private static final Logger log = LoggerFactory.getLogger(SshKeyRegistry.class);

  private final DirectoryAccessor directory;
  private final AuditEmitter auditEmitter;
  private final Clock clock;

  /**
   * Instantiates a new Ssh key registry.
   *
   * @param directory    the directory
   * @param auditEmitter the audit emitter
   * @param clock        the clock
   */
  @Inject
  public SshKeyRegistry(final DirectoryAccessor directory,
                        final AuditEmitter auditEmitter,
                        final Clock clock) {
    this.directory = directory;
    this.auditEmitter = auditEmitter;
    this.clock = clock;
  }

  /**
   * The caller's registered key.
   *
   * @param principal the caller
   * @return the key, or {@link RegisteredSshKeyResponse#none()}
   * @throws PortalException {@link ErrorCode#NOT_FOUND} when the caller has no directory account
   */
  public RegisteredSshKeyResponse registeredKey(final PortalPrincipal principal) {
    Map<String, String> attributes = directory.userAttributes(account(principal).id());
    String line = attributes.get(KEY_ATTRIBUTE);
    if (line == null || line.isBlank()) {
      return RegisteredSshKeyResponse.none();
    }
    return new RegisteredSshKeyResponse(line, fingerprintOrNull(line), attributes.get(REGISTERED_AT_ATTRIBUTE));
  }

  /**
   * Registers the caller's key, replacing any earlier one.
   *
   * @param principal the caller
   * @param line      the OpenSSH public key line
   * @return the registered key
   * @throws PortalException {@link ErrorCode#INVALID_PUBLIC_KEY} for a key that could not be signed,
   *                         {@link ErrorCode#NOT_FOUND} without a directory account
   */
  public RegisteredSshKeyResponse register(final PortalPrincipal principal, final String line) {
    SshPublicKey key = SshPublicKeys.parse(line);
    String userId = account(principal).id();
    String stored = line.trim();
    Instant now = clock.instant();
    Map<String, String> changes = Map.of(KEY_ATTRIBUTE, stored, REGISTERED_AT_ATTRIBUTE, now.toString());
    audited(principal, AuditAction.SSH_KEY_REGISTERED, key.fingerprint(), now,
        () -> directory.updateUserAttributes(userId, changes));
    log.info("SSH public key registered for {} fingerprint={}", principal.username(), key.fingerprint());
    return new RegisteredSshKeyResponse(stored, key.fingerprint(), now.toString());
  }

  /**
   * Removes the caller's registered key. Removing when none is registered succeeds.
   *
   * @param principal the caller
   */
  public void remove(final PortalPrincipal principal) {
    String userId = account(principal).id();
    Map<String, String> changes = new HashMap<>();
    changes.put(KEY_ATTRIBUTE, null);
    changes.put(REGISTERED_AT_ATTRIBUTE, null);
    audited(principal, AuditAction.SSH_KEY_REMOVED, principal.username(), clock.instant(),
        () -> directory.updateUserAttributes(userId, changes));
    log.info("SSH public key removed for {}", principal.username());
  }

  /**
   * Checks a key submitted for signing against the caller's registered key. Keys are compared by
   * their wire encoding, so comments and whitespace do not matter.
   *
   * @param principal the caller
   * @param submitted the vetted submitted key
   * @throws PortalException {@link ErrorCode#KEY_MISMATCH} when a different key is registered,
   *                         {@link ErrorCode#UPSTREAM_UNAVAILABLE} when the directory cannot be read
   */
  public void checkMatches(final PortalPrincipal principal, final SshPublicKey submitted) {
    Optional<UserResponse> user = directory.findUserByUsername(principal.username());
    if (user.isEmpty()) {
      log.debug("No directory account for {}; skipping registered key check", principal.username());
      return;
    }
    String line = directory.userAttributes(user.get().id()).get(KEY_ATTRIBUTE);
    if (line == null || line.isBlank()) {
      return;
    }
    SshPublicKey registered;
    try {
      registered = SshPublicKeys.parse(line);
    } catch (PortalException e) {
      log.warn("Registered SSH key of {} is unusable, not enforcing it: {}", principal.username(), e.getMessage());
      return;
    }
    if (!Arrays.equals(registered.blob(), submitted.blob())) {
      throw new PortalException(ErrorCode.KEY_MISMATCH, "submitted public key does not match your registered SSH key");
    }
  }

  private UserResponse account(final PortalPrincipal principal) {
    return directory.findUserByUsername(principal.username())
        .orElseThrow(() -> new PortalException(ErrorCode.NOT_FOUND, "user not found"));
  }

  private void audited(final PortalPrincipal principal, final AuditAction action, final String target,
                       final Instant at, final Runnable update) {
    try {
      update.run();
    } catch (PortalException e) {
      auditEmitter.appendBestEffort(AuditEvent.of(principal.username(), action, target, at,
          AuditResult.FAILURE, e.code().name()));
      throw e;
    }
    auditEmitter.append(AuditEvent.of(principal.username(), action, target, at, AuditResult.SUCCESS, null));
  }

  private static String fingerprintOrNull(final String line) {
    try {
      return SshPublicKeys.parse(line).fingerprint();
    } catch (PortalException e) {
      log.debug("Registered key does not parse: {}", e.getMessage());
      return null;
    }
  }
}
