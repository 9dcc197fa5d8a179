package com.codeheadsystems.tollgate.client.interceptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tollgate.client.accessor.AuthAccessor;
import com.codeheadsystems.tollgate.client.session.ClientSession;
import com.codeheadsystems.tollgate.client.session.InMemorySessionStorage;
import com.codeheadsystems.tollgate.model.auth.LoginRequest;
import com.codeheadsystems.tollgate.model.auth.LoginResponse;
import com.codeheadsystems.tollgate.model.auth.UserProfile;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Rejections against a real session, where the session may have moved on while the request was
 * in flight.
 */
@ExtendWith(MockitoExtension.class)
class RequestInterceptorSessionTest {

  private static final HttpRequest REQUEST = HttpRequest.newBuilder()
      .uri(URI.create("http://localhost:8080/api/inventory"))
      .GET()
      .build();

  @Mock private AuthAccessor accessor;
  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private final Executor direct = Runnable::run;

  private ClientSession session;
  private RequestInterceptor interceptor;

  @BeforeEach
  void setUp() {
    session = new ClientSession(accessor, new InMemorySessionStorage(),
        AuthAccessor.newObjectMapper(), direct, null);
    interceptor = new RequestInterceptor(session, httpClient);
  }

  @Test
  void sendAsync_401ForReplacedToken_keepsNewSession() {
    when(accessor.login(new LoginRequest("first", "Password1!"))).thenReturn(response("first"));
    when(accessor.login(new LoginRequest("second", "Password1!"))).thenReturn(response("second"));
    CompletableFuture<HttpResponse<String>> inFlight = new CompletableFuture<>();
    doReturn(inFlight).when(httpClient).sendAsync(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);

    session.login("first", "Password1!").join();
    CompletableFuture<HttpResponse<String>> result =
        interceptor.sendAsync(REQUEST, HttpResponse.BodyHandlers.ofString());
    session.logout().join();
    session.login("second", "Password1!").join();
    inFlight.complete(httpResponse);

    assertThat(result.join()).isSameAs(httpResponse);
    assertThat(session.isAuthenticated()).isTrue();
    assertThat(session.token()).contains("second.token");
  }

  @Test
  void sendAsync_401ForCurrentToken_clearsSession() {
    when(accessor.login(any())).thenReturn(response("first"));
    doReturn(CompletableFuture.completedFuture(httpResponse))
        .when(httpClient).sendAsync(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);

    session.login("first", "Password1!").join();
    interceptor.sendAsync(REQUEST, HttpResponse.BodyHandlers.ofString()).join();

    assertThat(session.isAuthenticated()).isFalse();
    assertThat(session.token()).isEmpty();
  }

  private static LoginResponse response(String username) {
    Instant now = Instant.now();
    UserProfile profile = new UserProfile("id-" + username, username, username + "@example.com",
        "John", "Doe", "John Doe", true, now, now);
    return new LoginResponse(username + ".token", profile, now.plus(Duration.ofHours(24)));
  }
}
