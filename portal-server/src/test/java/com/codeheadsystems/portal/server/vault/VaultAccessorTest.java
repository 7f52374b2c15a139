package com.codeheadsystems.portal.server.vault;

import static com.codeheadsystems.portal.server.testing.PortalAssertions.assertCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.testing.MutableClock;
import com.codeheadsystems.portal.server.testing.RequestBodies;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VaultAccessorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private VaultAccessor accessor;

  @BeforeEach
  void setUp() {
    VaultSettings settings = new VaultSettings(URI.create("https://vault.example.test:8200/"), "ssh-client-signer",
        "kubernetes", "identity-portal", 0.5, Duration.ofSeconds(1), Duration.ofMinutes(1), 3, Duration.ofSeconds(5));
    accessor = new VaultAccessor(httpClient, objectMapper, settings, Duration.ofSeconds(5), new MutableClock(NOW));
  }

  @Test
  @SuppressWarnings("unchecked")
  void login_postsRoleAndJwt() throws Exception {
    respond(200, "{\"auth\":{\"client_token\":\"s.abc\",\"lease_duration\":3600,\"renewable\":true}}");

    ServiceCredential credential = accessor.login("platform-jwt");

    assertThat(credential.token()).isEqualTo("s.abc");
    assertThat(credential.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
    assertThat(credential.renewable()).isTrue();
    HttpRequest request = captured();
    assertThat(request.uri()).isEqualTo(URI.create("https://vault.example.test:8200/v1/auth/kubernetes/login"));
    assertThat(request.headers().firstValue("X-Vault-Token")).isEmpty();
    JsonNode body = objectMapper.readTree(RequestBodies.body(request));
    assertThat(body.path("role").asText()).isEqualTo("identity-portal");
    assertThat(body.path("jwt").asText()).isEqualTo("platform-jwt");
  }

  @Test
  @SuppressWarnings("unchecked")
  void sign_sendsUserCertificateRequest() throws Exception {
    respond(200, "{\"data\":{\"serial_number\":\"3e:8f\",\"signed_key\":\"ssh-ed25519-cert-v01@openssh.com AAAA\\n\"}}");

    SignedCertificate certificate = accessor.sign("s.abc", "developer-role", "ssh-ed25519 AAAA alice",
        List.of("rocky", "deploy"), Duration.ofHours(2), "alice-1-abcd");

    assertThat(certificate.signedKey()).isEqualTo("ssh-ed25519-cert-v01@openssh.com AAAA");
    assertThat(certificate.serialNumber()).isEqualTo("3e:8f");
    HttpRequest request = captured();
    assertThat(request.uri().getPath()).isEqualTo("/v1/ssh-client-signer/sign/developer-role");
    assertThat(request.headers().firstValue("X-Vault-Token")).contains("s.abc");
    JsonNode body = objectMapper.readTree(RequestBodies.body(request));
    assertThat(body.path("valid_principals").asText()).isEqualTo("rocky,deploy");
    assertThat(body.path("ttl").asText()).isEqualTo("7200s");
    assertThat(body.path("cert_type").asText()).isEqualTo("user");
    assertThat(body.path("key_id").asText()).isEqualTo("alice-1-abcd");
  }

  @Test
  @SuppressWarnings("unchecked")
  void sign_withoutCertificate_isUpstreamUnavailable() throws Exception {
    respond(200, "{\"data\":{}}");

    assertCode(() -> accessor.sign("s.abc", "developer-role", "ssh-ed25519 AAAA", List.of("rocky"),
        Duration.ofHours(1), "k"), ErrorCode.UPSTREAM_UNAVAILABLE);
  }

  @Test
  @SuppressWarnings("unchecked")
  void sealed_isUpstreamUnavailable() throws Exception {
    respond(503, "{\"errors\":[\"Vault is sealed\"]}");

    assertCode(() -> accessor.renewSelf("s.abc"), ErrorCode.UPSTREAM_UNAVAILABLE);
  }

  @Test
  @SuppressWarnings("unchecked")
  void serverError_isUpstreamUnavailable() throws Exception {
    respond(500, "{\"errors\":[\"internal error\"]}");

    assertCode(() -> accessor.renewSelf("s.abc"), ErrorCode.UPSTREAM_UNAVAILABLE);
  }

  @Test
  @SuppressWarnings("unchecked")
  void permissionDenied_isForbidden() throws Exception {
    respond(403, "{\"errors\":[\"permission denied\"]}");

    assertCode(() -> accessor.sign("s.abc", "admin-role", "ssh-ed25519 AAAA", List.of("root"),
        Duration.ofHours(1), "k"), ErrorCode.FORBIDDEN);
  }

  @Test
  @SuppressWarnings("unchecked")
  void caPublicKey_isTrimmed() throws Exception {
    respond(200, "ssh-ed25519 AAAAC3NzaC1lZDI1NTE5 vault-ca\n");

    assertThat(accessor.caPublicKey()).isEqualTo("ssh-ed25519 AAAAC3NzaC1lZDI1NTE5 vault-ca");
    assertThat(captured().uri().getPath()).isEqualTo("/v1/ssh-client-signer/public_key");
  }

  @SuppressWarnings("unchecked")
  private void respond(final int status, final String body) throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(status);
    when(httpResponse.body()).thenReturn(body);
  }

  private HttpRequest captured() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    return captor.getValue();
  }
}
