package org.albs.exporter.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;
import org.albs.exporter.application.port.ServiceException;
import org.albs.exporter.testutil.StubHttpServer;
import org.junit.jupiter.api.Test;

class JsonHttpClientTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void resolvesRelativeAndAbsoluteTargets() {
    JsonHttpClient client = new JsonHttpClient("sign", URI.create("http://sign.local/api/v1"),
        HttpClient.newHttpClient(), mapper, Duration.ofSeconds(1), Optional.empty());

    assertEquals(URI.create("http://sign.local/api/v1/sign-keys/"), client.resolve("sign-keys/"));
    assertEquals(URI.create("http://sign.local/pulp/api/v3/tasks/1/"), client.resolve("/pulp/api/v3/tasks/1/"));
    assertEquals(URI.create("https://other.local/x"), client.resolve("https://other.local/x"));
  }

  @Test
  void emptyBodyYieldsMissingNode() throws Exception {
    try (StubHttpServer server = new StubHttpServer()) {
      server.route("DELETE", "/exporters/1/", 204, "");
      JsonHttpClient client = client(server);

      assertTrue(client.delete("/exporters/1/").isMissingNode());
    }
  }

  @Test
  void malformedJsonIsAServiceFailure() throws Exception {
    try (StubHttpServer server = new StubHttpServer()) {
      server.route("GET", "/broken/", 200, "{not json");
      JsonHttpClient client = client(server);

      ServiceException ex = assertThrows(ServiceException.class, () -> client.get("/broken/"));
      assertEquals(-1, ex.statusCode());
    }
  }

  @Test
  void errorBodiesAreTruncated() throws Exception {
    try (StubHttpServer server = new StubHttpServer()) {
      server.route("GET", "/big/", 500, "x".repeat(4096));
      JsonHttpClient client = client(server);

      ServiceException ex = assertThrows(ServiceException.class, () -> client.get("/big/"));
      assertEquals(500, ex.statusCode());
      assertTrue(ex.getMessage().contains("truncated"));
      assertTrue(ex.getMessage().length() < 1024);
    }
  }

  private JsonHttpClient client(StubHttpServer server) {
    return new JsonHttpClient("pulp", server.baseUri(), HttpClient.newHttpClient(), mapper,
        Duration.ofSeconds(5), Optional.empty());
  }
}
