package com.codeheadsystems.tollgate.springboot.security;

import com.codeheadsystems.tollgate.server.token.BearerToken;
import com.codeheadsystems.tollgate.server.token.TokenCodec;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying a valid bearer token. Invalid tokens leave the request
 * anonymous; the security chain then decides whether that is acceptable.
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private final TokenCodec tokenCodec;

  public BearerTokenAuthenticationFilter(TokenCodec tokenCodec) {
    this.tokenCodec = tokenCodec;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String token = BearerToken.parse(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (token != null) {
      tokenCodec.validate(token).claims().ifPresent(claims -> {
        TollgatePrincipal principal = new TollgatePrincipal(claims.subject(),
            claims.identity().username(), claims.identity().email(), claims.tokenId());
        UsernamePasswordAuthenticationToken auth =
            new UsernamePasswordAuthenticationToken(principal, null, List.of());
        SecurityContextHolder.getContext().setAuthentication(auth);
      });
    }
    filterChain.doFilter(request, response);
  }
}
