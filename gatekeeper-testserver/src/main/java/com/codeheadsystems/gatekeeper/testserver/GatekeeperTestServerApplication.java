package com.codeheadsystems.gatekeeper.testserver;

import com.codeheadsystems.gatekeeper.dropwizard.GatekeeperBundle;
import com.codeheadsystems.gatekeeper.dropwizard.GatekeeperConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local developer testing of gatekeeper clients.
 * Uses in-memory user and session stores (data lost on restart) and reads the signing secret
 * from the {@code JWT_SECRET_KEY} environment variable through {@code config/config.yml}.
 */
public class GatekeeperTestServerApplication extends Application<GatekeeperConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new GatekeeperTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "gatekeeper-testserver";
  }

  @Override
  public void initialize(Bootstrap<GatekeeperConfiguration> bootstrap) {
    // Strict: an unset ${VAR} without a default aborts startup, so a missing
    // JWT_SECRET_KEY can never fall through to an empty secret.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(true)
        )
    );
    bootstrap.addBundle(new GatekeeperBundle<>());
  }

  @Override
  public void run(GatekeeperConfiguration configuration, Environment environment) {
    // Protected endpoint: verifies that register + login produce a token that
    // grants access to downstream resources.
    environment.jersey().register(new WhoAmIResource());
  }
}
