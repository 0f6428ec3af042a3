package io.b2mash.b2b.contractassembly.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the tenant and actor supplied by the upstream isolation/auth layer into {@link
 * RequestScopes}. Requests without a tenant header continue unbound; services that need a tenant
 * reject them with a problem response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TenantFilter extends OncePerRequestFilter {

  public static final String TENANT_HEADER = "X-Tenant-Id";
  public static final String ACTOR_HEADER = "X-Actor-Id";
  public static final String ROLE_HEADER = "X-Actor-Role";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String tenantId = request.getHeader(TENANT_HEADER);
    if (tenantId == null || tenantId.isBlank()) {
      filterChain.doFilter(request, response);
      return;
    }

    UUID actorId = parseActor(request.getHeader(ACTOR_HEADER));
    var scope = new RequestScopes.Scope(tenantId, actorId, request.getHeader(ROLE_HEADER));
    try {
      RequestScopes.run(
          scope,
          () -> {
            try {
              filterChain.doFilter(request, response);
            } catch (IOException e) {
              throw new UncheckedIOException(e);
            } catch (ServletException e) {
              throw new WrappedServletException(e);
            }
          });
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } catch (WrappedServletException e) {
      throw e.servletException;
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private static UUID parseActor(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(header.trim());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static final class WrappedServletException extends RuntimeException {
    private final ServletException servletException;

    WrappedServletException(ServletException servletException) {
      super(servletException);
      this.servletException = servletException;
    }
  }
}
