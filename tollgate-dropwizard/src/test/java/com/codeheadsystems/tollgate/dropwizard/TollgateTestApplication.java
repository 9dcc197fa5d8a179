package com.codeheadsystems.tollgate.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 */
public class TollgateTestApplication extends Application<TollgateConfiguration> {

  public static void main(String[] args) throws Exception {
    new TollgateTestApplication().run(args);
  }

  @Override
  public String getName() {
    return "tollgate-test";
  }

  @Override
  public void initialize(Bootstrap<TollgateConfiguration> bootstrap) {
    bootstrap.addBundle(new TollgateBundle<>());
  }

  @Override
  public void run(TollgateConfiguration configuration, Environment environment) {
    // A protected endpoint standing in for application resources
    environment.jersey().register(new WhoAmIResource());
  }
}
