package com.codeheadsystems.tollgate.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.codeheadsystems.tollgate.client.accessor.AuthAccessor;
import com.codeheadsystems.tollgate.client.exceptions.AuthRejectedException;
import com.codeheadsystems.tollgate.client.interceptor.RequestInterceptor;
import com.codeheadsystems.tollgate.client.model.ServerConnectionInfo;
import com.codeheadsystems.tollgate.client.routing.AuthGuard;
import com.codeheadsystems.tollgate.client.routing.NavigationResult;
import com.codeheadsystems.tollgate.client.routing.Navigator;
import com.codeheadsystems.tollgate.client.routing.RouteTable;
import com.codeheadsystems.tollgate.client.session.AuthState;
import com.codeheadsystems.tollgate.client.session.ClientSession;
import com.codeheadsystems.tollgate.client.session.InMemorySessionStorage;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Drives the client session, guard and interceptor against a running server.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class ClientSessionIntegrationTest {

  static final DropwizardAppExtension<TollgateConfiguration> APP =
      new DropwizardAppExtension<>(
          TollgateTestApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private ExecutorService executor;
  private HttpClient httpClient;
  private AuthAccessor accessor;
  private ClientSession session;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    httpClient = HttpClient.newHttpClient();
    accessor = new AuthAccessor(httpClient, AuthAccessor.newObjectMapper(),
        new ServerConnectionInfo(URI.create(baseUrl())));
    session = new ClientSession(accessor, new InMemorySessionStorage(),
        AuthAccessor.newObjectMapper(), executor, null);
  }

  @AfterEach
  void tearDown() {
    session.shutdown();
    executor.shutdownNow();
  }

  @Test
  void loginNavigateAndLogout() throws Exception {
    accessor.register(AuthIntegrationTest.registration("sessionuser"));
    Navigator navigator = new Navigator(RouteTable.defaultTable(new AuthGuard()), session, executor);
    List<AuthState> states = new CopyOnWriteArrayList<>();
    session.subscribe(states::add);

    NavigationResult denied = navigator.navigate("/inventory?sort=name").join();
    session.login("sessionuser", "Password1!").join();
    NavigationResult resumed = navigator.resumeAfterLogin().join();
    String token = session.token().orElseThrow();
    session.logout().join();

    assertThat(denied.location()).isEqualTo("/login?returnUrl=%2Finventory%3Fsort%3Dname");
    assertThat(resumed.routeName()).isEqualTo("inventory");
    assertThat(states).extracting(AuthState::authenticated).containsExactly(false, true, false);
    assertThat(session.isAuthenticated()).isFalse();
    assertThat(catchThrowableOfType(() -> accessor.refresh(token), AuthRejectedException.class))
        .isNotNull();
  }

  @Test
  void interceptor_rejectedToken_clearsSession() throws Exception {
    accessor.register(AuthIntegrationTest.registration("interceptuser"));
    session.login("interceptuser", "Password1!").join();
    RequestInterceptor interceptor = new RequestInterceptor(session, httpClient);
    HttpRequest whoAmI = HttpRequest.newBuilder(URI.create(baseUrl() + "/api/whoami")).GET().build();

    HttpResponse<String> ok = interceptor.send(whoAmI, HttpResponse.BodyHandlers.ofString());
    accessor.logout(session.token().orElseThrow());
    HttpResponse<String> rejected = interceptor.send(whoAmI, HttpResponse.BodyHandlers.ofString());

    assertThat(ok.statusCode()).isEqualTo(200);
    assertThat(ok.body()).contains("interceptuser");
    assertThat(rejected.statusCode()).isEqualTo(401);
    assertThat(session.isAuthenticated()).isFalse();
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
