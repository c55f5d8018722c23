package com.codeheadsystems.gatekeeper.testserver;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.gatekeeper.dropwizard.GatekeeperConfiguration;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(DropwizardExtensionsSupport.class)
class GatekeeperTestServerApplicationTest {

  static final DropwizardAppExtension<GatekeeperConfiguration> APP =
      new DropwizardAppExtension<>(
          GatekeeperTestServerApplication.class,
          ResourceHelpers.resourceFilePath("testserver-config.yml"));

  private final HttpClient httpClient = HttpClient.newHttpClient();
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void initialize_installsEnvironmentSubstitution() {
    GatekeeperTestServerApplication application = new GatekeeperTestServerApplication();
    Bootstrap<GatekeeperConfiguration> bootstrap = new Bootstrap<>(application);

    application.initialize(bootstrap);

    assertThat(bootstrap.getConfigurationSourceProvider()).isInstanceOf(SubstitutingSourceProvider.class);
  }

  @Test
  void registerLoginWhoAmI_roundTrip() throws Exception {
    String credentials = "{\"email\":\"dev@example.com\",\"password\":\"dev-password\"}";
    HttpResponse<String> registered = post("/auth/register", credentials);
    assertThat(registered.statusCode()).isEqualTo(201);
    long userId = objectMapper.readTree(registered.body()).get("user").get("id").asLong();

    HttpResponse<String> login = post("/auth/login", credentials);
    assertThat(login.statusCode()).isEqualTo(200);
    String token = objectMapper.readTree(login.body()).get("session").get("token").asText();

    HttpResponse<String> whoAmI = httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + "/api/whoami"))
            .header("Authorization", "Bearer " + token)
            .GET()
            .build(),
        HttpResponse.BodyHandlers.ofString());

    assertThat(whoAmI.statusCode()).isEqualTo(200);
    JsonNode body = objectMapper.readTree(whoAmI.body());
    assertThat(body.get("userId").asLong()).isEqualTo(userId);
  }

  private HttpResponse<String> post(String path, String json) throws Exception {
    return httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build(),
        HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
