package com.codeheadsystems.tollgate.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tollgate.client.exceptions.AuthAccessorException;
import com.codeheadsystems.tollgate.client.exceptions.AuthRejectedException;
import com.codeheadsystems.tollgate.client.exceptions.AuthRequestException;
import com.codeheadsystems.tollgate.client.model.ServerConnectionInfo;
import com.codeheadsystems.tollgate.model.auth.ErrorCode;
import com.codeheadsystems.tollgate.model.auth.LoginRequest;
import com.codeheadsystems.tollgate.model.auth.LoginResponse;
import com.codeheadsystems.tollgate.model.auth.RegisterRequest;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthAccessorTest {

  private static final URI ENDPOINT = URI.create("http://localhost:8080");
  private static final String LOGIN_JSON = "{\"token\":\"abc.def.ghi\","
      + "\"user\":{\"id\":\"id-1\",\"username\":\"johndoe\",\"email\":\"t@example.com\","
      + "\"firstName\":\"John\",\"lastName\":\"Doe\",\"fullName\":\"John Doe\",\"active\":true,"
      + "\"lastLoginAt\":\"2026-03-01T10:00:00Z\",\"createdAt\":\"2026-03-01T09:00:00Z\"},"
      + "\"expiresAt\":\"2026-03-02T10:00:00Z\",\"somethingNew\":1}";

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private AuthAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new AuthAccessor(httpClient, AuthAccessor.newObjectMapper(),
        new ServerConnectionInfo(ENDPOINT));
  }

  @Test
  void login_success_postsJsonAndParsesResponse() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn(LOGIN_JSON);

    LoginResponse response = accessor.login(new LoginRequest("johndoe", "Password1!"));

    assertThat(response.token()).isEqualTo("abc.def.ghi");
    assertThat(response.user().username()).isEqualTo("johndoe");
    assertThat(response.expiresAt()).isEqualTo(Instant.parse("2026-03-02T10:00:00Z"));
    HttpRequest sent = sentRequest();
    assertThat(sent.uri()).isEqualTo(URI.create("http://localhost:8080/api/auth/login"));
    assertThat(sent.method()).isEqualTo("POST");
    assertThat(sent.headers().firstValue("Content-Type")).contains("application/json");
    assertThat(sent.headers().firstValue("Authorization")).isEmpty();
  }

  @Test
  void refresh_sendsBearerToken() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn(LOGIN_JSON);

    accessor.refresh("old.token");

    HttpRequest sent = sentRequest();
    assertThat(sent.uri().getPath()).isEqualTo("/api/auth/refresh");
    assertThat(sent.headers().firstValue("Authorization")).contains("Bearer old.token");
  }

  @Test
  void me_usesGet() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{\"id\":\"id-1\",\"username\":\"johndoe\"}");

    assertThat(accessor.me("abc").username()).isEqualTo("johndoe");
    assertThat(sentRequest().method()).isEqualTo("GET");
  }

  @Test
  void endpointWithPath_isPrefixed() throws Exception {
    accessor = new AuthAccessor(httpClient, AuthAccessor.newObjectMapper(),
        new ServerConnectionInfo(URI.create("http://localhost:8080/app")));
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);

    accessor.logout("abc");

    assertThat(sentRequest().uri()).isEqualTo(URI.create("http://localhost:8080/app/api/auth/logout"));
  }

  @Test
  void login_401_throwsRejectedWithServerError() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);
    when(httpResponse.body())
        .thenReturn("{\"code\":\"INVALID_CREDENTIALS\",\"message\":\"Invalid username or password\"}");

    AuthRejectedException e = catchThrowableOfType(
        () -> accessor.login(new LoginRequest("johndoe", "WrongPass1!")),
        AuthRejectedException.class);

    assertThat(e.status()).isEqualTo(401);
    assertThat(e.error().code()).isEqualTo(ErrorCode.INVALID_CREDENTIALS);
    assertThat(e).hasMessage("Invalid username or password");
  }

  @Test
  void refresh_401WithoutBody_usesFallbackError() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);
    when(httpResponse.body()).thenReturn("");

    AuthRejectedException e = catchThrowableOfType(() -> accessor.refresh("abc"),
        AuthRejectedException.class);

    assertThat(e.error().code()).isEqualTo(ErrorCode.UNAUTHORIZED);
    assertThat(e).hasMessage("Server returned HTTP 401");
  }

  @Test
  void register_409_throwsRequestException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(409);
    when(httpResponse.body()).thenReturn("{\"code\":\"CONFLICT\",\"message\":\"Email already exists\"}");

    AuthRequestException e = catchThrowableOfType(
        () -> accessor.register(new RegisterRequest("t@example.com", "Password1!", "johndoe",
            "John", "Doe")),
        AuthRequestException.class);

    assertThat(e.status()).isEqualTo(409);
    assertThat(e.error().code()).isEqualTo(ErrorCode.CONFLICT);
  }

  @Test
  void register_400WithHtmlBody_usesFallbackError() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(400);
    when(httpResponse.body()).thenReturn("<html>bad</html>");

    AuthRequestException e = catchThrowableOfType(
        () -> accessor.register(new RegisterRequest(null, null, null, null, null)),
        AuthRequestException.class);

    assertThat(e.error().code()).isEqualTo(ErrorCode.VALIDATION);
  }

  @Test
  void login_500_throwsAccessorException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(503);

    assertThatThrownBy(() -> accessor.login(new LoginRequest("johndoe", "Password1!")))
        .isInstanceOf(AuthAccessorException.class)
        .hasMessageContaining("503");
  }

  @Test
  void login_ioException_throwsAccessorException() throws Exception {
    doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> accessor.login(new LoginRequest("johndoe", "Password1!")))
        .isInstanceOf(AuthAccessorException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void login_interrupted_restoresInterruptFlag() throws Exception {
    doThrow(new InterruptedException()).when(httpClient).send(any(), any());

    try {
      assertThatThrownBy(() -> accessor.login(new LoginRequest("johndoe", "Password1!")))
          .isInstanceOf(AuthAccessorException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @SuppressWarnings("unchecked")
  private HttpRequest sentRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }
}
