package com.codeheadsystems.portal.server.ssh;

import java.time.Instant;
import java.util.Base64;
import java.util.List;

/**
 * Decodes OpenSSH certificates (PROTOCOL.certkeys) returned by the signer.
 */
public final class SshCertificateReader {

  private static final int USER_CERT = 1;

  private SshCertificateReader() {
  }

  /**
   * Reads a certificate line.
   *
   * @param line {@code <type> <base64> [comment]}
   * @return the certificate
   * @throws IllegalArgumentException when the line is not a supported certificate
   */
  public static SshCertificate read(final String line) {
    if (line == null) {
      throw new IllegalArgumentException("certificate is null");
    }
    String[] parts = line.trim().split("\\s+", 3);
    if (parts.length < 2) {
      throw new IllegalArgumentException("certificate must be '<type> <base64>'");
    }
    SshWireReader reader = new SshWireReader(Base64.getDecoder().decode(parts[1]));
    String type = reader.readString();
    if (!type.equals(parts[0])) {
      throw new IllegalArgumentException("declared type " + parts[0] + " does not match " + type);
    }
    reader.readBytes(); // nonce
    skipPublicKey(type, reader);
    long serial = reader.readUint64();
    int certType = reader.readUint32();
    String keyId = reader.readString();
    List<String> principals = reader.readStringList();
    Instant validAfter = instant(reader.readUint64());
    Instant validBefore = instant(reader.readUint64());
    List<String> criticalOptions = reader.readOptionNames();
    List<String> extensions = reader.readOptionNames();
    return new SshCertificate(type, serial, certType == USER_CERT, keyId, List.copyOf(principals),
        validAfter, validBefore, List.copyOf(criticalOptions), List.copyOf(extensions));
  }

  private static void skipPublicKey(final String type, final SshWireReader reader) {
    switch (type) {
      case "ssh-ed25519-cert-v01@openssh.com" -> reader.readBytes();
      case "ssh-rsa-cert-v01@openssh.com" -> {
        reader.readBytes(); // e
        reader.readBytes(); // n
      }
      case "ecdsa-sha2-nistp256-cert-v01@openssh.com",
          "ecdsa-sha2-nistp384-cert-v01@openssh.com",
          "ecdsa-sha2-nistp521-cert-v01@openssh.com" -> {
        reader.readBytes(); // curve
        reader.readBytes(); // point
      }
      default -> throw new IllegalArgumentException("unsupported certificate type " + type);
    }
  }

  private static Instant instant(final long epochSeconds) {
    // Values beyond Long.MAX_VALUE (read as negative) mean "forever".
    return epochSeconds < 0 ? Instant.MAX : Instant.ofEpochSecond(Math.min(epochSeconds, Instant.MAX.getEpochSecond()));
  }
}
