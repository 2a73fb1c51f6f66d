package com.codeheadsystems.hivemind.testserver;

import com.codeheadsystems.hivemind.dropwizard.HivemindBundle;
import com.codeheadsystems.hivemind.dropwizard.HivemindConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable hive server for local testing. Storage, peers and the gossip secret come from
 * {@code config/config.yml}, each overridable through environment variables, so several
 * instances can be started side by side as gossip peers.
 * <pre>
 *   java -jar hivemind-testserver.jar server config/config.yml
 * </pre>
 */
public class HivemindServerApplication extends Application<HivemindConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new HivemindServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "hivemind-testserver";
  }

  @Override
  public void initialize(Bootstrap<HivemindConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution so each instance can be configured from its
    // environment without its own config file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new HivemindBundle<>());
  }

  @Override
  public void run(HivemindConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }
}
