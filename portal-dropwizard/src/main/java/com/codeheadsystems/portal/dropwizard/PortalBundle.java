package com.codeheadsystems.portal.dropwizard;

import com.codeheadsystems.portal.dropwizard.auth.JsonUnauthorizedHandler;
import com.codeheadsystems.portal.dropwizard.auth.PortalAuthenticator;
import com.codeheadsystems.portal.dropwizard.auth.PortalAuthorizer;
import com.codeheadsystems.portal.dropwizard.config.Durations;
import com.codeheadsystems.portal.dropwizard.config.OidcConfiguration;
import com.codeheadsystems.portal.dropwizard.config.RoleConfiguration;
import com.codeheadsystems.portal.dropwizard.config.VaultConfiguration;
import com.codeheadsystems.portal.dropwizard.health.CredentialStoreHealthCheck;
import com.codeheadsystems.portal.dropwizard.health.HealthResource;
import com.codeheadsystems.portal.dropwizard.health.SigningKeysHealthCheck;
import com.codeheadsystems.portal.model.PublicConfigResponse;
import com.codeheadsystems.portal.server.audit.AuditEmitter;
import com.codeheadsystems.portal.server.audit.AuditSink;
import com.codeheadsystems.portal.server.audit.FileAuditSink;
import com.codeheadsystems.portal.server.audit.Slf4jAuditSink;
import com.codeheadsystems.portal.server.auth.IdentityProviderAccessor;
import com.codeheadsystems.portal.server.auth.LoginManager;
import com.codeheadsystems.portal.server.auth.OidcAccessor;
import com.codeheadsystems.portal.server.auth.OidcSettings;
import com.codeheadsystems.portal.server.auth.PortalPrincipal;
import com.codeheadsystems.portal.server.auth.SigningKeyCache;
import com.codeheadsystems.portal.server.auth.TokenValidator;
import com.codeheadsystems.portal.server.directory.AdminTokenProvider;
import com.codeheadsystems.portal.server.directory.DirectoryAccessor;
import com.codeheadsystems.portal.server.directory.DirectoryAdminGateway;
import com.codeheadsystems.portal.server.directory.KeycloakDirectoryAccessor;
import com.codeheadsystems.portal.server.directory.KeycloakSettings;
import com.codeheadsystems.portal.server.directory.SelfProfileReader;
import com.codeheadsystems.portal.server.exception.JsonProcessingExceptionMapper;
import com.codeheadsystems.portal.server.exception.PortalExceptionMapper;
import com.codeheadsystems.portal.server.exception.UnexpectedExceptionMapper;
import com.codeheadsystems.portal.server.exception.WebApplicationExceptionMapper;
import com.codeheadsystems.portal.server.filter.RequestIdFilter;
import com.codeheadsystems.portal.server.filter.RequestLoggingFilter;
import com.codeheadsystems.portal.server.kubeconfig.ClusterSettings;
import com.codeheadsystems.portal.server.resource.AuthResource;
import com.codeheadsystems.portal.server.resource.ConfigResource;
import com.codeheadsystems.portal.server.resource.GroupResource;
import com.codeheadsystems.portal.server.resource.KubeconfigResource;
import com.codeheadsystems.portal.server.resource.SelfResource;
import com.codeheadsystems.portal.server.resource.SshResource;
import com.codeheadsystems.portal.server.resource.UserResource;
import com.codeheadsystems.portal.server.role.GroupResolver;
import com.codeheadsystems.portal.server.role.RoleTable;
import com.codeheadsystems.portal.server.ssh.SshCertificateIssuer;
import com.codeheadsystems.portal.server.ssh.SshKeyRegistry;
import com.codeheadsystems.portal.server.vault.CertificateSigner;
import com.codeheadsystems.portal.server.vault.VaultAccessor;
import com.codeheadsystems.portal.server.vault.VaultCredentialStoreClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.glassfish.jersey.server.filter.RolesAllowedDynamicFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the identity portal into a Dropwizard application.
 * <p>
 * Registers the REST resources, the bearer token filter, the JSON exception mappers, the request
 * id and access log filters, health checks, and the lifecycle of the background refresh threads.
 * Requires a {@link PortalConfiguration}.
 * <p>
 * Against real upstreams:
 * <pre>{@code
 *   bootstrap.addBundle(new PortalBundle<>());
 * }</pre>
 * <p>
 * With some upstreams replaced, e.g. in tests:
 * <pre>{@code
 *   bootstrap.addBundle(new PortalBundle<>(new PortalUpstreams(fakeIdp, fakeSigner, fakeDirectory, List.of())));
 * }</pre>
 */
public class PortalBundle<C extends PortalConfiguration> implements ConfiguredBundle<C> {

  /** Where the browser login starts. */
  public static final String LOGIN_PATH = "/api/v1/auth/login";

  private static final Logger log = LoggerFactory.getLogger(PortalBundle.class);

  private final PortalUpstreams upstreams;
  private final Clock clock;

  /**
   * Creates a bundle that talks to the configured identity provider, directory and credential
   * store.
   */
  public PortalBundle() {
    this(PortalUpstreams.fromConfiguration());
  }

  /**
   * Creates a bundle using the given upstream replacements.
   *
   * @param upstreams the upstreams
   */
  public PortalBundle(final PortalUpstreams upstreams) {
    this(upstreams, Clock.systemUTC());
  }

  /**
   * Creates a bundle using the given upstream replacements and clock.
   *
   * @param upstreams the upstreams
   * @param clock     the clock
   */
  public PortalBundle(final PortalUpstreams upstreams, final Clock clock) {
    this.upstreams = upstreams;
    this.clock = clock;
  }

  @Override
  public void initialize(final Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(final C configuration, final Environment environment) {
    final OidcConfiguration oidc = configuration.getOidc();
    final OidcSettings oidcSettings = oidc.toSettings();
    final RoleTable roleTable = RoleConfiguration.toTable(configuration.getRoles());
    final ClusterSettings cluster = configuration.getCluster().toSettings(oidcSettings.issuer(), oidc.getClientId());
    final Duration timeout = Durations.toJava(configuration.getUpstreamTimeout());
    final ObjectMapper objectMapper = environment.getObjectMapper();
    log.info("Starting identity portal: issuer={} roles={} cluster={}",
        oidcSettings.issuer(), roleTable.roles().size(), cluster.name());

    final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();

    // Audit
    final List<AuditSink> sinks = new ArrayList<>();
    sinks.add(new Slf4jAuditSink(objectMapper));
    if (configuration.getAudit().getFile() != null && !configuration.getAudit().getFile().isBlank()) {
      sinks.add(new FileAuditSink(Path.of(configuration.getAudit().getFile()), objectMapper));
    }
    sinks.addAll(upstreams.auditSinks());
    final AuditEmitter auditEmitter = new AuditEmitter(sinks, environment.metrics());

    // Identity
    final IdentityProviderAccessor identityProvider = upstreams.identityProvider() != null
        ? upstreams.identityProvider()
        : new OidcAccessor(httpClient, objectMapper, oidcSettings, timeout);
    final SigningKeyCache keyCache = new SigningKeyCache(identityProvider, clock,
        oidcSettings.keyCacheTtl(), oidcSettings.maxKeyStaleness(), oidcSettings.minRefreshInterval());
    final TokenValidator tokenValidator = new TokenValidator(keyCache, oidcSettings, clock);
    final GroupResolver groupResolver = new GroupResolver(roleTable);
    final LoginManager loginManager = new LoginManager(identityProvider, tokenValidator, auditEmitter,
        oidcSettings, clock);

    // Directory
    final DirectoryAccessor directory = upstreams.directoryAccessor() != null
        ? upstreams.directoryAccessor()
        : buildDirectory(oidc, httpClient, objectMapper, timeout);
    final DirectoryAdminGateway gateway = new DirectoryAdminGateway(directory, auditEmitter, clock);
    final SshKeyRegistry keyRegistry = new SshKeyRegistry(directory, auditEmitter, clock);

    // Signing
    final CertificateSigner signer = buildSigner(configuration.getVault(), httpClient, objectMapper, timeout);
    final SshCertificateIssuer issuer = new SshCertificateIssuer(groupResolver, signer, keyRegistry, auditEmitter);

    // Filters and error mapping
    environment.jersey().register(new RequestIdFilter());
    environment.jersey().register(new RequestLoggingFilter(environment.metrics()));
    environment.jersey().register(new PortalExceptionMapper());
    environment.jersey().register(new WebApplicationExceptionMapper());
    environment.jersey().register(new JsonProcessingExceptionMapper());
    environment.jersey().register(new UnexpectedExceptionMapper());

    // Bearer token auth
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<PortalPrincipal>()
            .setAuthenticator(new PortalAuthenticator(tokenValidator, auditEmitter, clock))
            .setAuthorizer(new PortalAuthorizer(groupResolver))
            .setPrefix("Bearer")
            .setRealm("identity-portal")
            .setUnauthorizedHandler(new JsonUnauthorizedHandler())
            .buildAuthFilter()));
    environment.jersey().register(RolesAllowedDynamicFeature.class);
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(PortalPrincipal.class));

    // Resources
    environment.jersey().register(new AuthResource(loginManager, groupResolver));
    environment.jersey().register(new SshResource(issuer, clock));
    environment.jersey().register(new KubeconfigResource(cluster, auditEmitter, clock));
    environment.jersey().register(new ConfigResource(
        new PublicConfigResponse(oidcSettings.issuer(), oidc.getRealm(), oidc.getClientId(), LOGIN_PATH)));
    environment.jersey().register(new UserResource(gateway));
    environment.jersey().register(new GroupResource(gateway));
    environment.jersey().register(new SelfResource(new SelfProfileReader(directory, groupResolver), keyRegistry));
    environment.jersey().register(new HealthResource(environment.healthChecks()));

    // Health
    environment.healthChecks().register("signing-keys", new SigningKeysHealthCheck(keyCache));
    environment.healthChecks().register("credential-store", new CredentialStoreHealthCheck(signer));

    // Lifecycle
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        keyCache.start();
      }

      @Override
      public void stop() {
        keyCache.stop();
        loginManager.shutdown();
      }
    });
    if (signer instanceof VaultCredentialStoreClient client) {
      environment.lifecycle().manage(new Managed() {
        @Override
        public void start() {
          client.start();
        }

        @Override
        public void stop() {
          client.stop();
        }
      });
    }
  }

  private CertificateSigner buildSigner(final VaultConfiguration vault,
                                        final HttpClient httpClient,
                                        final ObjectMapper objectMapper,
                                        final Duration timeout) {
    if (upstreams.certificateSigner() != null) {
      return upstreams.certificateSigner();
    }
    if (vault == null) {
      throw new IllegalStateException("vault configuration is required when no certificate signer is supplied");
    }
    VaultAccessor accessor = new VaultAccessor(httpClient, objectMapper, vault.toSettings(), timeout, clock);
    log.info("Using credential store at {} mount={}", vault.getAddress(), vault.getSshMount());
    return new VaultCredentialStoreClient(accessor, vault.toSettings(), vault.tokenReader(), clock);
  }

  private DirectoryAccessor buildDirectory(final OidcConfiguration oidc,
                                           final HttpClient httpClient,
                                           final ObjectMapper objectMapper,
                                           final Duration timeout) {
    KeycloakSettings settings = oidc.toKeycloakSettings();
    AdminTokenProvider tokenProvider = new AdminTokenProvider(httpClient, objectMapper, settings, timeout, clock);
    return new KeycloakDirectoryAccessor(httpClient, objectMapper, settings, tokenProvider, timeout);
  }
}
