package com.codeheadsystems.tollgate.testserver.cli;

import com.codeheadsystems.tollgate.client.accessor.AuthAccessor;
import com.codeheadsystems.tollgate.client.interceptor.RequestInterceptor;
import com.codeheadsystems.tollgate.client.model.ServerConnectionInfo;
import com.codeheadsystems.tollgate.client.session.ClientSession;
import com.codeheadsystems.tollgate.client.session.FileSessionStorage;
import com.codeheadsystems.tollgate.model.auth.LoginResponse;
import com.codeheadsystems.tollgate.model.auth.RegisterRequest;
import com.codeheadsystems.tollgate.model.auth.UserProfile;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Command-line client that keeps a session in a file between invocations.
 *
 * <pre>
 * Usage:
 *   SessionCli [--server &lt;url&gt;] [--session-file &lt;path&gt;] &lt;command&gt; [args]
 *
 * Commands:
 *   register &lt;username&gt; &lt;email&gt; &lt;password&gt; &lt;first&gt; &lt;last&gt;
 *   login &lt;username-or-email&gt; &lt;password&gt;
 *   status
 *   whoami
 *   refresh
 *   logout
 * </pre>
 *
 * <p>{@code whoami} calls the server's protected {@code GET /api/whoami} through the request
 * interceptor, so a stored token that is close to expiry is refreshed first.
 */
public class SessionCli {

  static final String DEFAULT_SERVER = "http://localhost:8080";
  static final Path DEFAULT_SESSION_FILE =
      Path.of(System.getProperty("user.home"), ".tollgate", "session.properties");

  private final PrintStream out;
  private final PrintStream err;

  public SessionCli(final PrintStream out, final PrintStream err) {
    this.out = out;
    this.err = err;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(new SessionCli(System.out, System.err).run(args));
  }

  /**
   * Runs one command.
   *
   * @param args command-line arguments
   * @return the process exit code
   */
  public int run(String[] args) {
    String server = DEFAULT_SERVER;
    Path sessionFile = DEFAULT_SESSION_FILE;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      if ("--server".equals(args[i]) && i + 1 < args.length) {
        server = args[++i];
      } else if ("--session-file".equals(args[i]) && i + 1 < args.length) {
        sessionFile = Path.of(args[++i]);
      } else if (!args[i].startsWith("-")) {
        positional.add(args[i]);
      }
    }

    if (positional.isEmpty()) {
      return usage();
    }

    ObjectMapper objectMapper = AuthAccessor.newObjectMapper();
    HttpClient httpClient = HttpClient.newHttpClient();
    AuthAccessor accessor = new AuthAccessor(httpClient, objectMapper,
        new ServerConnectionInfo(URI.create(server)));
    ExecutorService executor = Executors.newSingleThreadExecutor();
    ClientSession session = new ClientSession(accessor, new FileSessionStorage(sessionFile),
        objectMapper, executor, null);
    try {
      return dispatch(positional, server, session, httpClient);
    } catch (CompletionException e) {
      err.println("Error: " + e.getCause().getMessage());
      return 1;
    } catch (RuntimeException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    } finally {
      session.shutdown();
      executor.shutdown();
    }
  }

  private int dispatch(List<String> positional, String server, ClientSession session,
                       HttpClient httpClient) {
    String command = positional.get(0);
    List<String> rest = positional.subList(1, positional.size());
    switch (command) {
      case "register":
        if (rest.size() != 5) {
          return usage();
        }
        UserProfile created = session.register(new RegisterRequest(
            rest.get(1), rest.get(2), rest.get(0), rest.get(3), rest.get(4))).join();
        out.println("Registered " + created.username() + " (" + created.id() + ")");
        return 0;
      case "login":
        if (rest.size() != 2) {
          return usage();
        }
        LoginResponse login = session.login(rest.get(0), rest.get(1)).join();
        out.println("Logged in as " + login.user().username());
        out.println("  expires : " + login.expiresAt());
        return 0;
      case "status":
        if (!session.isAuthenticated()) {
          out.println("Not logged in");
          return 0;
        }
        out.println("Logged in as " + session.currentUser().map(UserProfile::username).orElse("?"));
        out.println("  expires : " + session.expiresAt().map(Object::toString).orElse("?"));
        return 0;
      case "whoami":
        return whoAmI(server, session, httpClient);
      case "refresh":
        LoginResponse refreshed = session.refresh().join();
        out.println("Refreshed, expires " + refreshed.expiresAt());
        return 0;
      case "logout":
        session.logout().join();
        out.println("Logged out");
        return 0;
      default:
        err.println("Unknown command: " + command);
        return usage();
    }
  }

  private int whoAmI(String server, ClientSession session, HttpClient httpClient) {
    if (!session.isAuthenticated()) {
      err.println("Not logged in");
      return 1;
    }
    RequestInterceptor interceptor = new RequestInterceptor(session, httpClient);
    HttpRequest request = HttpRequest.newBuilder(URI.create(server + "/api/whoami")).GET().build();
    try {
      HttpResponse<String> response =
          interceptor.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        err.println("Server returned HTTP " + response.statusCode());
        return 1;
      }
      out.println(response.body());
      return 0;
    } catch (IOException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      err.println("Interrupted");
      return 1;
    }
  }

  private int usage() {
    err.println("Usage: SessionCli [--server <url>] [--session-file <path>] <command> [args]");
    err.println();
    err.println("  --server <url>          Server base URL (default: " + DEFAULT_SERVER + ")");
    err.println("  --session-file <path>   Session file (default: " + DEFAULT_SESSION_FILE + ")");
    err.println();
    err.println("Commands:");
    err.println("  register <username> <email> <password> <first> <last>");
    err.println("  login <username-or-email> <password>");
    err.println("  status | whoami | refresh | logout");
    return 1;
  }
}
