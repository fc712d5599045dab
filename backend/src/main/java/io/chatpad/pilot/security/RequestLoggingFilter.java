package io.chatpad.pilot.security;

import io.chatpad.pilot.context.RequestScopes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String MDC_REQUEST_ID = "requestId";
  static final String MDC_PRINCIPAL_ID = "principalId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      UUID principalId = RequestScopes.getPrincipalIdOrNull();
      if (principalId != null) {
        MDC.put(MDC_PRINCIPAL_ID, principalId.toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_PRINCIPAL_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
