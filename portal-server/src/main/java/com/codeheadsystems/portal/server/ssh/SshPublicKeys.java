package com.codeheadsystems.portal.server.ssh;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Set;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.util.OpenSSHPublicKeyUtil;

/**
 * Parses and vets user-submitted SSH public keys before anything is sent for signing.
 * <p>
 * Accepted: {@code ssh-ed25519}, and {@code ssh-rsa} of at least 4096 bits. The line may be at
 * most 16 KiB and its declared type must match the type inside the blob.
 */
public final class SshPublicKeys {

  /** Longest accepted public key line, in bytes. */
  public static final int MAX_LENGTH = 16 * 1024;
  /** Smallest accepted RSA modulus. */
  public static final int MIN_RSA_BITS = 4096;

  private static final String ED25519 = "ssh-ed25519";
  private static final String RSA = "ssh-rsa";
  private static final Set<String> ACCEPTED_TYPES = Set.of(ED25519, RSA);

  private SshPublicKeys() {
  }

  /**
   * Parses an authorized_keys style line.
   *
   * @param line the line, {@code type base64 [comment]}
   * @return the key
   * @throws PortalException {@link ErrorCode#INVALID_PUBLIC_KEY} for anything unacceptable
   */
  public static SshPublicKey parse(final String line) {
    if (line == null || line.isBlank()) {
      throw invalid("public key is required");
    }
    if (line.getBytes(StandardCharsets.UTF_8).length > MAX_LENGTH) {
      throw invalid("public key exceeds " + MAX_LENGTH + " bytes");
    }
    String[] parts = line.trim().split("\\s+", 3);
    if (parts.length < 2) {
      throw invalid("public key must be '<type> <base64> [comment]'");
    }
    String declaredType = parts[0];
    if (!ACCEPTED_TYPES.contains(declaredType)) {
      throw invalid("unsupported key type " + declaredType + "; use ssh-ed25519 or ssh-rsa (4096+ bits)");
    }
    byte[] blob;
    try {
      blob = Base64.getDecoder().decode(parts[1]);
    } catch (IllegalArgumentException e) {
      throw invalid("public key is not valid base64");
    }
    String wireType;
    try {
      wireType = new SshWireReader(blob).readString();
    } catch (IllegalArgumentException e) {
      throw invalid("public key blob is truncated");
    }
    if (!declaredType.equals(wireType)) {
      throw invalid("declared type " + declaredType + " does not match key type " + wireType);
    }
    AsymmetricKeyParameter parameters;
    try {
      parameters = OpenSSHPublicKeyUtil.parsePublicKey(blob);
    } catch (RuntimeException e) {
      throw invalid("public key could not be decoded");
    }
    if (RSA.equals(wireType)) {
      if (!(parameters instanceof RSAKeyParameters rsa)) {
        throw invalid("public key could not be decoded");
      }
      if (rsa.getModulus().bitLength() < MIN_RSA_BITS) {
        throw invalid("RSA keys must be at least " + MIN_RSA_BITS + " bits");
      }
    } else if (!(parameters instanceof Ed25519PublicKeyParameters)) {
      throw invalid("public key could not be decoded");
    }
    return new SshPublicKey(wireType, blob, parts.length == 3 ? parts[2] : "", fingerprint(blob));
  }

  /**
   * OpenSSH SHA-256 fingerprint of a key blob.
   *
   * @param blob the blob
   * @return {@code SHA256:<unpadded base64>}
   */
  public static String fingerprint(final byte[] blob) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(blob);
      return "SHA256:" + Base64.getEncoder().withoutPadding().encodeToString(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  private static PortalException invalid(final String message) {
    return new PortalException(ErrorCode.INVALID_PUBLIC_KEY, message);
  }
}
