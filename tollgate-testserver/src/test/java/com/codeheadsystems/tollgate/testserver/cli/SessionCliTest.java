package com.codeheadsystems.tollgate.testserver.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tollgate.dropwizard.TollgateConfiguration;
import com.codeheadsystems.tollgate.testserver.TollgateTestServerApplication;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

@ExtendWith(DropwizardExtensionsSupport.class)
class SessionCliTest {

  static final DropwizardAppExtension<TollgateConfiguration> APP =
      new DropwizardAppExtension<>(
          TollgateTestServerApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  @TempDir
  Path tempDir;

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private Path sessionFile;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    sessionFile = tempDir.resolve("session.properties");
  }

  @Test
  void run_noCommand_printsUsage() {
    assertThat(run()).isEqualTo(1);
    assertThat(err()).contains("Usage: SessionCli");
  }

  @Test
  void run_unknownCommand_printsUsage() {
    assertThat(run("fly")).isEqualTo(1);
    assertThat(err()).contains("Unknown command: fly");
  }

  @Test
  void status_withoutSession_reportsNotLoggedIn() {
    assertThat(run("status")).isEqualTo(0);
    assertThat(out()).contains("Not logged in");
  }

  @Test
  void sessionSurvivesBetweenInvocations() {
    assertThat(run("register", "cliuser", "cliuser@example.com", "Password1!", "Cli", "User"))
        .isEqualTo(0);
    assertThat(run("login", "cliuser", "Password1!")).isEqualTo(0);
    assertThat(Files.exists(sessionFile)).isTrue();

    assertThat(run("whoami")).isEqualTo(0);
    assertThat(out()).contains("\"username\":\"cliuser\"");

    assertThat(run("refresh")).isEqualTo(0);
    assertThat(run("status")).isEqualTo(0);
    assertThat(out()).contains("Logged in as cliuser");

    assertThat(run("logout")).isEqualTo(0);
    assertThat(run("whoami")).isEqualTo(1);
    assertThat(err()).contains("Not logged in");
  }

  @Test
  void login_wrongPassword_fails() {
    run("register", "cliuser2", "cliuser2@example.com", "Password1!", "Cli", "User");

    assertThat(run("login", "cliuser2", "WrongPass1!")).isEqualTo(1);
    assertThat(err()).contains("Error:");
  }

  private int run(String... command) {
    String[] args = new String[command.length + 4];
    args[0] = "--server";
    args[1] = "http://localhost:" + APP.getLocalPort();
    args[2] = "--session-file";
    args[3] = sessionFile.toString();
    System.arraycopy(command, 0, args, 4, command.length);
    return new SessionCli(new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8)).run(args);
  }

  private String out() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return err.toString(StandardCharsets.UTF_8);
  }
}
