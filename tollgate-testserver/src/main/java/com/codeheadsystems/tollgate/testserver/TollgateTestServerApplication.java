package com.codeheadsystems.tollgate.testserver;

import com.codeheadsystems.tollgate.dropwizard.TollgateBundle;
import com.codeheadsystems.tollgate.dropwizard.TollgateConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local testing of the session client.
 * Accounts and revocations live in memory and are lost on restart. The token signing secret
 * comes from {@code config/config.yml}, so tokens survive a restart when the secret is set.
 *
 * <pre>
 *   java -cp ... com.codeheadsystems.tollgate.testserver.TollgateTestServerApplication \
 *       server config/config.yml
 * </pre>
 */
public class TollgateTestServerApplication extends Application<TollgateConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new TollgateTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "tollgate-testserver";
  }

  @Override
  public void initialize(Bootstrap<TollgateConfiguration> bootstrap) {
    // ${ENV_VAR:-default} substitution lets the environment override single keys.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new TollgateBundle<>());
  }

  @Override
  public void run(TollgateConfiguration configuration, Environment environment) {
    environment.jersey().register(new WhoAmIResource());
  }
}
