package com.codeheadsystems.portal.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.portal.server.audit.AuditAction;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditEvent;
import com.codeheadsystems.portal.server.audit.AuditResult;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.auth.TokenValidator;
import com.codeheadsystems.portal.server.exception.ErrorCode;
import com.codeheadsystems.portal.server.exception.PortalException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PortalAuthenticatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private TokenValidator tokenValidator;
  @Mock private AuditEmitter auditEmitter;

  private PortalAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    authenticator = new PortalAuthenticator(tokenValidator, auditEmitter, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void validToken_yieldsPrincipal() {
    PortalPrincipal principal = new PortalPrincipal("sub-1", "alice", "alice@example.test",
        new TreeSet<>(List.of("developers")), NOW.plusSeconds(300));
    when(tokenValidator.validate("good")).thenReturn(principal);

    assertThat(authenticator.authenticate("good")).contains(principal);
    verify(auditEmitter, never()).appendBestEffort(any());
  }

  @Test
  void rejectedToken_isCountedAuditedAndRethrown() {
    when(tokenValidator.validate("expired"))
        .thenThrow(new PortalException(ErrorCode.UNAUTHENTICATED, "token expired"));

    assertThatThrownBy(() -> authenticator.authenticate("expired"))
        .isInstanceOf(PortalException.class)
        .extracting(e -> ((PortalException) e).code())
        .isEqualTo(ErrorCode.UNAUTHENTICATED);

    verify(auditEmitter).authenticationFailed(ErrorCode.UNAUTHENTICATED);
    ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
    verify(auditEmitter).appendBestEffort(captor.capture());
    assertThat(captor.getValue().action()).isEqualTo(AuditAction.TOKEN_REJECTED);
    assertThat(captor.getValue().result()).isEqualTo(AuditResult.DENIED);
    assertThat(captor.getValue().detail()).isEqualTo("UNAUTHENTICATED");
    assertThat(captor.getValue().timestamp()).isEqualTo(NOW);
  }

  @Test
  void keysUnavailable_isCountedButNotAuditedAsRejection() {
    when(tokenValidator.validate("any"))
        .thenThrow(new PortalException(ErrorCode.UPSTREAM_UNAVAILABLE, "no signing keys"));

    assertThatThrownBy(() -> authenticator.authenticate("any"))
        .isInstanceOf(PortalException.class);

    verify(auditEmitter).authenticationFailed(ErrorCode.UPSTREAM_UNAVAILABLE);
    verify(auditEmitter, never()).appendBestEffort(any());
  }
}
