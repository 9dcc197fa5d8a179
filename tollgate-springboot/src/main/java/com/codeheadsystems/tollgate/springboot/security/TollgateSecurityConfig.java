package com.codeheadsystems.tollgate.springboot.security;

import com.codeheadsystems.tollgate.server.token.TokenCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Stateless bearer-token security. The auth endpoints check tokens themselves so they can answer
 * with a typed error body; everything else requires an authenticated principal.
 */
@Configuration
@EnableWebSecurity
public class TollgateSecurityConfig {

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                 TokenCodec tokenCodec) throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers("/api/auth/**", "/actuator/health", "/error").permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        // Not a bean, so the servlet container does not also register it outside the chain.
        .addFilterBefore(new BearerTokenAuthenticationFilter(tokenCodec),
            UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }
}
