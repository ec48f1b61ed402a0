package io.livclinic.clinic.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code /api/**} requests carrying an {@code X-API-TOKEN} header. Requests without
 * the header pass through untouched so HTTP Basic can handle them; a header with an unknown token
 * is rejected with 401.
 */
public class ApiTokenAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(ApiTokenAuthFilter.class);

  public static final String API_TOKEN_HEADER = "X-API-TOKEN";

  private final List<ClinicSecurityProperties.ApiToken> tokens;

  public ApiTokenAuthFilter(List<ClinicSecurityProperties.ApiToken> tokens) {
    this.tokens = List.copyOf(tokens);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String presented = request.getHeader(API_TOKEN_HEADER);
    if (presented == null || presented.isBlank()) {
      filterChain.doFilter(request, response);
      return;
    }

    var match = find(presented.strip());
    if (match == null) {
      log.warn(
          "Rejected API token: method={}, path={}", request.getMethod(), request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid API token");
      return;
    }

    var context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(
        new ApiTokenAuthentication(new ApiTokenPrincipal(match.id(), match.name())));
    SecurityContextHolder.setContext(context);
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }

  private ClinicSecurityProperties.ApiToken find(String presented) {
    byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
    for (var token : tokens) {
      if (token.token() != null
          && MessageDigest.isEqual(candidate, token.token().getBytes(StandardCharsets.UTF_8))) {
        return token;
      }
    }
    return null;
  }
}
