package com.codeheadsystems.portal.dropwizard;

import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * The identity portal server. Run with {@code server config/portal.yml}; {@code ${VAR}}
 * references in the file are replaced from the environment.
 */
public class IdentityPortalApplication extends Application<PortalConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(final String[] args) throws Exception {
    new IdentityPortalApplication().run(args);
  }

  @Override
  public String getName() {
    return "identity-portal";
  }

  @Override
  public void initialize(final Bootstrap<PortalConfiguration> bootstrap) {
    bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
        bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
    bootstrap.addBundle(new PortalBundle<>());
  }

  @Override
  public void run(final PortalConfiguration configuration, final Environment environment) {
    // Everything is registered by the bundle
  }
}
