package io.chatpad.pilot.security;

import io.chatpad.pilot.context.RequestScopes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the JWT subject to {@link RequestScopes} for the rest of the chain. A subject that is not
 * a UUID is rejected with 401.
 */
@Component
public class PrincipalFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(PrincipalFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      filterChain.doFilter(request, response);
      return;
    }

    UUID principalId = parseSubject(jwtAuth.getToken().getSubject());
    if (principalId == null) {
      log.warn("Token subject is not a principal id: {}", jwtAuth.getToken().getSubject());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid token subject");
      return;
    }

    try {
      RequestScopes.callAs(
          principalId,
          () -> {
            filterChain.doFilter(request, response);
            return null;
          });
    } catch (IOException | ServletException | RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new ServletException(e);
    }
  }

  static UUID parseSubject(String subject) {
    if (subject == null) {
      return null;
    }
    try {
      return UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }
}
