package com.codeheadsystems.tollgate.client.interceptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tollgate.client.exceptions.AuthAccessorException;
import com.codeheadsystems.tollgate.client.session.ClientSession;
import com.codeheadsystems.tollgate.model.auth.LoginResponse;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RequestInterceptorTest {

  private static final HttpRequest REQUEST = HttpRequest.newBuilder()
      .uri(URI.create("http://localhost:8080/api/inventory"))
      .GET()
      .build();

  @Mock private ClientSession session;
  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private RequestInterceptor interceptor;

  @BeforeEach
  void setUp() {
    interceptor = new RequestInterceptor(session, httpClient);
  }

  @Test
  void send_withSession_attachesBearerToken() throws Exception {
    when(session.token()).thenReturn(Optional.of("abc"));
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);

    interceptor.send(REQUEST, HttpResponse.BodyHandlers.ofString());

    HttpRequest sent = sentRequest();
    assertThat(sent.headers().firstValue("Authorization")).contains("Bearer abc");
    assertThat(sent.uri()).isEqualTo(REQUEST.uri());
    verify(session, never()).invalidate(anyString());
  }

  @Test
  void send_withoutSession_sendsRequestUnchanged() throws Exception {
    when(session.token()).thenReturn(Optional.empty());
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);

    interceptor.send(REQUEST, HttpResponse.BodyHandlers.ofString());

    assertThat(sentRequest()).isSameAs(REQUEST);
    verify(session, never()).invalidate(anyString());
  }

  @Test
  void send_existingAuthorization_isKept() throws Exception {
    HttpRequest own = HttpRequest.newBuilder(REQUEST.uri()).header("Authorization", "Basic x")
        .GET().build();
    when(session.token()).thenReturn(Optional.of("abc"));
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);

    interceptor.send(own, HttpResponse.BodyHandlers.ofString());

    assertThat(sentRequest().headers().allValues("Authorization")).containsExactly("Basic x");
  }

  @Test
  void send_401_invalidatesSession() throws Exception {
    when(session.token()).thenReturn(Optional.of("abc"));
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);

    HttpResponse<String> response = interceptor.send(REQUEST, HttpResponse.BodyHandlers.ofString());

    assertThat(response).isSameAs(httpResponse);
    verify(session).invalidate("abc");
  }

  @Test
  void send_refreshDue_refreshesBeforeSending() throws Exception {
    when(session.shouldRefresh()).thenReturn(true);
    when(session.refresh()).thenReturn(CompletableFuture.completedFuture(
        new LoginResponse("fresh", null, Instant.EPOCH)));
    when(session.token()).thenReturn(Optional.of("fresh"));
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);

    interceptor.send(REQUEST, HttpResponse.BodyHandlers.ofString());

    InOrder order = inOrder(session, httpClient);
    order.verify(session).refresh();
    order.verify(httpClient).send(any(), any());
    assertThat(sentRequest().headers().firstValue("Authorization")).contains("Bearer fresh");
  }

  @Test
  void send_refreshFails_stillSendsWithCurrentToken() throws Exception {
    when(session.shouldRefresh()).thenReturn(true);
    when(session.refresh()).thenReturn(
        CompletableFuture.failedFuture(new AuthAccessorException("down", null)));
    when(session.token()).thenReturn(Optional.of("old"));
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);

    interceptor.send(REQUEST, HttpResponse.BodyHandlers.ofString());

    assertThat(sentRequest().headers().firstValue("Authorization")).contains("Bearer old");
  }

  @Test
  void sendAsync_403_invalidatesSession() {
    when(session.token()).thenReturn(Optional.of("abc"));
    doReturn(CompletableFuture.completedFuture(httpResponse))
        .when(httpClient).sendAsync(any(), any());
    when(httpResponse.statusCode()).thenReturn(403);

    HttpResponse<String> response =
        interceptor.sendAsync(REQUEST, HttpResponse.BodyHandlers.ofString()).join();

    assertThat(response).isSameAs(httpResponse);
    verify(session).invalidate("abc");
  }

  @Test
  void sendAsync_refreshDue_waitsForRefresh() {
    CompletableFuture<LoginResponse> refresh = new CompletableFuture<>();
    when(session.shouldRefresh()).thenReturn(true);
    when(session.refresh()).thenReturn(refresh);
    when(session.token()).thenReturn(Optional.of("fresh"));
    doReturn(CompletableFuture.completedFuture(httpResponse))
        .when(httpClient).sendAsync(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);

    CompletableFuture<HttpResponse<String>> result =
        interceptor.sendAsync(REQUEST, HttpResponse.BodyHandlers.ofString());
    assertThat(result).isNotDone();
    refresh.complete(new LoginResponse("fresh", null, Instant.EPOCH));

    assertThat(result.join()).isSameAs(httpResponse);
  }

  @SuppressWarnings("unchecked")
  private HttpRequest sentRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }
}
