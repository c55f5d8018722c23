package com.codeheadsystems.gatekeeper.testserver;

import com.codeheadsystems.gatekeeper.server.auth.AuthenticatedUser;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Bearer-protected endpoint that returns the authenticated user id.
 * Use this to verify the flow end-to-end: register, log in to obtain a token, then call
 * GET /api/whoami with {@code Authorization: Bearer <token>} and confirm the user id.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  /**
   * Returns the user id bound by the bearer filter.
   *
   * @param user the identity injected by the Dropwizard auth filter
   * @return a map containing {@code userId}
   */
  @GET
  public Map<String, Long> whoAmI(@Auth AuthenticatedUser user) {
    return Map.of("userId", user.userId());
  }
}
