package com.flamingo.ai.chunker;

import com.google.common.annotations.VisibleForTesting;
import java.util.Arrays;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for the semantic chunking service.
 *
 * <p>Started with {@code --input-dir=...} it chunks that document and exits; otherwise it serves
 * the REST API.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ChunkerApplication {

  public static void main(String[] args) {
    SpringApplication application = new SpringApplication(ChunkerApplication.class);
    if (isCommandLineRun(args)) {
      application.setWebApplicationType(WebApplicationType.NONE);
      System.exit(runToCompletion(application, args));
    }
    application.run(args);
  }

  /**
   * Runs a batch invocation and closes its context so executor threads do not keep the JVM alive.
   *
   * @return the exit code collected from the context
   */
  @VisibleForTesting
  static int runToCompletion(SpringApplication application, String[] args) {
    ConfigurableApplicationContext context = application.run(args);
    return SpringApplication.exit(context);
  }

  @VisibleForTesting
  static boolean isCommandLineRun(String[] args) {
    return Arrays.stream(args).anyMatch(arg -> arg.startsWith("--input-dir"));
  }
}
