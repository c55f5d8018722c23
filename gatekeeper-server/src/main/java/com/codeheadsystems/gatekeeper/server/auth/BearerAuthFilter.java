package com.codeheadsystems.gatekeeper.server.auth;

import com.codeheadsystems.gatekeeper.model.auth.ErrorResponse;
import jakarta.annotation.Priority;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.security.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS binding of {@link BearerTokenGate}.
 * <p>
 * Rejected requests are aborted with 401 and {@code {"error": "<reason>"}} before any resource
 * method runs. Admitted requests get a {@link SecurityContext} whose principal is the
 * {@link AuthenticatedUser}, and the session's last-use tracking is refreshed.
 */
@Priority(Priorities.AUTHENTICATION)
public class BearerAuthFilter implements ContainerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(BearerAuthFilter.class);

  /**
   * Authentication scheme reported by the installed security context.
   */
  public static final String SCHEME = "Bearer";

  private final BearerTokenGate gate;
  private final SessionManager sessionManager;

  @Context
  private HttpServletRequest servletRequest;

  public BearerAuthFilter(BearerTokenGate gate, SessionManager sessionManager) {
    this.gate = gate;
    this.sessionManager = sessionManager;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    GateDecision decision = gate.evaluate(requestContext.getHeaderString(HttpHeaders.AUTHORIZATION));
    if (!decision.admitted()) {
      log.debug("Rejected {} {}: {}", requestContext.getMethod(),
          requestContext.getUriInfo().getPath(), decision.reason());
      requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
          .type(MediaType.APPLICATION_JSON_TYPE)
          .entity(new ErrorResponse(decision.reason().message()))
          .build());
      return;
    }

    AuthenticatedUser user = decision.user();
    SecurityContext original = requestContext.getSecurityContext();
    boolean secure = original != null && original.isSecure();
    requestContext.setSecurityContext(new SecurityContext() {
      @Override
      public Principal getUserPrincipal() {
        return user;
      }

      @Override
      public boolean isUserInRole(String role) {
        return false;
      }

      @Override
      public boolean isSecure() {
        return secure;
      }

      @Override
      public String getAuthenticationScheme() {
        return SCHEME;
      }
    });

    String clientIp = ClientAddress.resolve(
        requestContext.getHeaderString(ClientAddress.FORWARDED_FOR),
        requestContext.getHeaderString(ClientAddress.REAL_IP),
        remoteAddr());
    sessionManager.recordUse(decision.claims(), clientIp,
        requestContext.getHeaderString(HttpHeaders.USER_AGENT));
  }

  private String remoteAddr() {
    try {
      return servletRequest == null ? null : servletRequest.getRemoteAddr();
    } catch (IllegalStateException e) {
      // Proxy with no request bound to the current thread.
      log.debug("No servlet request available: {}", e.getMessage());
      return null;
    }
  }
}
