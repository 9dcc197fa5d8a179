package com.codeheadsystems.tollgate.client.interceptor;

import com.codeheadsystems.tollgate.client.session.ClientSession;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends application requests with the session's bearer token.
 * <p>
 * Before sending, a due refresh is awaited (it is single-flight, so concurrent requests share
 * it). A 401 or 403 answer to a request that carried a token clears the session locally, as
 * long as that token is still the current one.
 */
public class RequestInterceptor {

  private static final Logger log = LoggerFactory.getLogger(RequestInterceptor.class);
  private static final String AUTHORIZATION = "Authorization";

  private final ClientSession session;
  private final HttpClient httpClient;

  public RequestInterceptor(final ClientSession session, final HttpClient httpClient) {
    this.session = session;
    this.httpClient = httpClient;
  }

  /**
   * Sends a request, blocking until the response arrives.
   *
   * @param request     the request, without credentials
   * @param bodyHandler the response body handler
   * @param <T>         the body type
   * @return the response
   * @throws IOException          on transport failure
   * @throws InterruptedException if interrupted while waiting
   */
  public <T> HttpResponse<T> send(final HttpRequest request,
                                  final HttpResponse.BodyHandler<T> bodyHandler)
      throws IOException, InterruptedException {
    if (session.shouldRefresh()) {
      awaitRefresh();
    }
    Optional<String> token = session.token();
    HttpResponse<T> response = httpClient.send(authorize(request, token), bodyHandler);
    return inspect(response, token);
  }

  /**
   * Sends a request asynchronously.
   *
   * @param request     the request, without credentials
   * @param bodyHandler the response body handler
   * @param <T>         the body type
   * @return the response
   */
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      final HttpRequest request, final HttpResponse.BodyHandler<T> bodyHandler) {
    CompletableFuture<Void> ready = session.shouldRefresh()
        ? session.refresh().handle((r, e) -> {
          if (e != null) {
            log.warn("Refresh before request failed: {}", cause(e).getMessage());
          }
          return null;
        })
        : CompletableFuture.completedFuture(null);
    return ready.thenCompose(v -> {
      Optional<String> token = session.token();
      return httpClient.sendAsync(authorize(request, token), bodyHandler)
          .thenApply(response -> inspect(response, token));
    });
  }

  /**
   * Copies a request, adding {@code Authorization: Bearer <token>} when a token is present and
   * the request has no credentials of its own.
   *
   * @param request the request
   * @param token   the token
   * @return the request to send
   */
  static HttpRequest authorize(HttpRequest request, Optional<String> token) {
    if (token.isEmpty() || request.headers().firstValue(AUTHORIZATION).isPresent()) {
      return request;
    }
    return HttpRequest.newBuilder(request, (name, value) -> true)
        .header(AUTHORIZATION, "Bearer " + token.get())
        .build();
  }

  private <T> HttpResponse<T> inspect(HttpResponse<T> response, Optional<String> token) {
    int status = response.statusCode();
    if ((status == 401 || status == 403) && token.isPresent()) {
      if (session.invalidate(token.get())) {
        log.info("Request to {} rejected with HTTP {}, session cleared", response.uri(), status);
      } else {
        log.debug("Request to {} rejected with HTTP {} for a replaced token", response.uri(),
            status);
      }
    }
    return response;
  }

  private void awaitRefresh() {
    try {
      session.refresh().join();
    } catch (CompletionException | CancellationException e) {
      log.warn("Refresh before request failed: {}", cause(e).getMessage());
    }
  }

  private static Throwable cause(Throwable e) {
    return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
  }
}
