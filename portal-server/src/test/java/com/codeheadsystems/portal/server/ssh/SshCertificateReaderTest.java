package com.codeheadsystems.portal.server.ssh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.portal.server.testing.SshFixtures;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SshCertificateReaderTest {

  private static final Instant AFTER = Instant.parse("2026-03-01T12:00:00Z");
  private static final Instant BEFORE = Instant.parse("2026-03-01T14:00:00Z");

  @Test
  void read_ed25519UserCertificate() {
    String line = SshFixtures.certificate(42, "alice-1772366400-0a1b2c3d", List.of("rocky", "deploy"),
        AFTER, BEFORE, List.of("permit-pty", "permit-port-forwarding"));

    SshCertificate certificate = SshCertificateReader.read(line);

    assertThat(certificate.type()).isEqualTo(SshFixtures.ED25519_CERT_TYPE);
    assertThat(certificate.serial()).isEqualTo(42);
    assertThat(certificate.userCertificate()).isTrue();
    assertThat(certificate.keyId()).isEqualTo("alice-1772366400-0a1b2c3d");
    assertThat(certificate.principals()).containsExactly("rocky", "deploy");
    assertThat(certificate.validAfter()).isEqualTo(AFTER);
    assertThat(certificate.validBefore()).isEqualTo(BEFORE);
    assertThat(certificate.criticalOptions()).isEmpty();
    assertThat(certificate.extensions()).containsExactly("permit-pty", "permit-port-forwarding");
  }

  @Test
  void read_rsaLayout() {
    SshCertificate certificate = SshCertificateReader.read(SshFixtures.rsaCertificate(7, "k", AFTER, BEFORE));

    assertThat(certificate.serial()).isEqualTo(7);
    assertThat(certificate.principals()).containsExactly("rocky");
    assertThat(certificate.validBefore()).isEqualTo(BEFORE);
  }

  @Test
  void read_hostCertificate_isNotUserCertificate() {
    String line = SshFixtures.certificate(1, 2, "host", List.of("db1"), AFTER.getEpochSecond(),
        BEFORE.getEpochSecond(), List.of());

    assertThat(SshCertificateReader.read(line).userCertificate()).isFalse();
  }

  @Test
  void read_foreverValidity_isInstantMax() {
    String line = SshFixtures.certificate(1, 1, "k", List.of("rocky"), 0, -1L, List.of());

    SshCertificate certificate = SshCertificateReader.read(line);

    assertThat(certificate.validAfter()).isEqualTo(Instant.EPOCH);
    assertThat(certificate.validBefore()).isEqualTo(Instant.MAX);
  }

  @Test
  void serialString_isUnsigned() {
    String line = SshFixtures.certificate(-2L, 1, "k", List.of(), 0, 1, List.of());

    assertThat(SshCertificateReader.read(line).serialString()).isEqualTo("18446744073709551614");
  }

  @Test
  void read_plainPublicKey_isRejected() {
    assertThatThrownBy(() -> SshCertificateReader.read(SshFixtures.ed25519PublicKey("x")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unsupported certificate type");
  }

  @Test
  void read_truncated_isRejected() {
    String line = SshFixtures.certificate(1, "k", List.of("rocky"), AFTER, BEFORE, List.of());
    String[] parts = line.trim().split(" ");
    String truncated = parts[0] + " " + parts[1].substring(0, 120);

    assertThatThrownBy(() -> SshCertificateReader.read(truncated)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void read_declaredTypeMismatch_isRejected() {
    String line = SshFixtures.certificate(1, "k", List.of("rocky"), AFTER, BEFORE, List.of());

    assertThatThrownBy(() -> SshCertificateReader.read(line.replace(SshFixtures.ED25519_CERT_TYPE + " ",
        "ssh-rsa-cert-v01@openssh.com ")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not match");
  }
}
