package com.codeheadsystems.gatekeeper.server.resource;

import com.codeheadsystems.gatekeeper.model.auth.ErrorResponse;
import com.codeheadsystems.gatekeeper.model.auth.LoginRequest;
import com.codeheadsystems.gatekeeper.model.auth.LoginResponse;
import com.codeheadsystems.gatekeeper.model.auth.MessageResponse;
import com.codeheadsystems.gatekeeper.model.auth.RegisterRequest;
import com.codeheadsystems.gatekeeper.model.auth.RegisterResponse;
import com.codeheadsystems.gatekeeper.server.auth.AuthenticatedUser;
import com.codeheadsystems.gatekeeper.server.auth.ClientAddress;
import com.codeheadsystems.gatekeeper.server.manager.CredentialManager;
import com.codeheadsystems.gatekeeper.server.store.DuplicateEmailException;
import jakarta.annotation.security.PermitAll;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for account registration and session login / logout.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/register} - create an account (201)</li>
 *   <li>{@code POST /auth/login}    - check credentials and issue a bearer token</li>
 *   <li>{@code POST /auth/logout}   - revoke every session of the caller; bearer token required</li>
 * </ul>
 * All business logic is delegated to {@link CredentialManager}; this class only translates its
 * exceptions into HTTP responses with an {@code {"error": "..."}} body.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final CredentialManager credentialManager;

  public AuthResource(CredentialManager credentialManager) {
    this.credentialManager = credentialManager;
  }

  @POST
  @Path("/register")
  public Response register(RegisterRequest req) {
    log.debug("register()");
    try {
      RegisterResponse response = credentialManager.register(requireBody(req));
      return Response.status(Response.Status.CREATED).entity(response).build();
    } catch (IllegalArgumentException e) {
      throw error(Response.Status.BAD_REQUEST, e.getMessage());
    } catch (DuplicateEmailException e) {
      throw error(Response.Status.CONFLICT, e.getMessage());
    }
  }

  @POST
  @Path("/login")
  public LoginResponse login(LoginRequest req,
                             @HeaderParam(ClientAddress.FORWARDED_FOR) String forwardedFor,
                             @HeaderParam(ClientAddress.REAL_IP) String realIp,
                             @HeaderParam(HttpHeaders.USER_AGENT) String userAgent,
                             @Context HttpServletRequest servletRequest) {
    log.debug("login()");
    String clientIp = ClientAddress.resolve(forwardedFor, realIp,
        servletRequest == null ? null : servletRequest.getRemoteAddr());
    try {
      return credentialManager.login(requireBody(req), clientIp, userAgent);
    } catch (IllegalArgumentException e) {
      throw error(Response.Status.BAD_REQUEST, e.getMessage());
    } catch (SecurityException e) {
      throw error(Response.Status.UNAUTHORIZED, e.getMessage());
    }
  }

  @POST
  @Path("/logout")
  @PermitAll
  public MessageResponse logout(@Context SecurityContext securityContext) {
    long userId = AuthenticatedUser.userIdOf(
        securityContext == null ? null : securityContext.getUserPrincipal());
    log.debug("logout(user={})", userId);
    try {
      return credentialManager.logout(userId);
    } catch (SecurityException e) {
      throw error(Response.Status.UNAUTHORIZED, e.getMessage());
    }
  }

  private static <T> T requireBody(T body) {
    if (body == null) {
      throw new IllegalArgumentException("Request body is required");
    }
    return body;
  }

  private static WebApplicationException error(Response.Status status, String message) {
    return new WebApplicationException(message, Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(message))
        .build());
  }
}
