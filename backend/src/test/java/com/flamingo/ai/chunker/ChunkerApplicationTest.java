package com.flamingo.ai.chunker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

@DisplayName("ChunkerApplication Tests")
class ChunkerApplicationTest {

  @Test
  @DisplayName("should close the context once a command-line run has finished")
  void shouldCloseContextAfterCommandLineRun() {
    String[] args = {"--input-dir=/data/report"};
    SpringApplication application = mock(SpringApplication.class);
    ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);
    when(application.run(args)).thenReturn(context);

    int exitCode = ChunkerApplication.runToCompletion(application, args);

    assertThat(exitCode).isZero();
    verify(context).close();
  }
}
