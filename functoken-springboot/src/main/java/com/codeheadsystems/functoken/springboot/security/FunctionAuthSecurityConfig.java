package com.codeheadsystems.functoken.springboot.security;

import com.codeheadsystems.functoken.FunctionAuthenticator;
import com.codeheadsystems.functoken.springboot.config.FunctionAuthProperties;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

@Configuration
@EnableWebSecurity
public class FunctionAuthSecurityConfig {

  @Bean
  public SecurityFilterChain functionAuthFilterChain(HttpSecurity http,
                                                     FunctionAuthenticator authenticator,
                                                     FunctionAuthProperties props) throws Exception {
    RequestMatcher permitted = permittedPaths(props.getPermitPaths());
    // Built here rather than as a bean so the servlet container does not register it a second time.
    FunctionTokenAuthenticationFilter tokenFilter = new FunctionTokenAuthenticationFilter(authenticator, permitted);
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(permitted).permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(tokenFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }

  static RequestMatcher permittedPaths(List<String> paths) {
    if (paths == null || paths.isEmpty()) {
      return request -> false;
    }
    List<RequestMatcher> matchers = paths.stream()
        .map(AntPathRequestMatcher::antMatcher)
        .map(RequestMatcher.class::cast)
        .toList();
    return new OrRequestMatcher(matchers);
  }
}
