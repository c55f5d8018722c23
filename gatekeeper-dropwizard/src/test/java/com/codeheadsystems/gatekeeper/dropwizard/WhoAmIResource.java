package com.codeheadsystems.gatekeeper.dropwizard;

import com.codeheadsystems.gatekeeper.server.auth.AuthenticatedUser;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Test-only protected endpoint that returns the authenticated user's id.
 * Demonstrates how consumers can protect their own routes using {@code @Auth AuthenticatedUser}.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  @GET
  public Map<String, Long> whoAmI(@Auth AuthenticatedUser user) {
    return Map.of("userId", user.userId());
  }
}
