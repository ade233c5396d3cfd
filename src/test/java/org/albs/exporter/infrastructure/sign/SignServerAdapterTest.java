package org.albs.exporter.infrastructure.sign;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.albs.exporter.application.port.ServiceException;
import org.albs.exporter.application.port.SigningPort.SignResult;
import org.albs.exporter.domain.SignKey;
import org.albs.exporter.infrastructure.http.JsonHttpClient;
import org.albs.exporter.testutil.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignServerAdapterTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private StubHttpServer server;
  private SignServerAdapter adapter;

  @BeforeEach
  void setUp() throws Exception {
    server = new StubHttpServer();
    adapter = new SignServerAdapter(new JsonHttpClient("sign", server.baseUri(), HttpClient.newHttpClient(),
        mapper, Duration.ofSeconds(5), Optional.of("Bearer token")));
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void returnsArmoredSignature() throws Exception {
    server.route("POST", "/" + SignServerAdapter.SIGN_TASK, 200, "{\"asc_content\": \"-----BEGIN PGP SIGNATURE-----\"}");

    SignResult result = adapter.sign("<repomd/>", "51d6647ec21ad6ea");

    assertEquals(Optional.of("-----BEGIN PGP SIGNATURE-----"), result.signature());
    JsonNode body = mapper.readTree(server.requests().get(0).body());
    assertEquals("<repomd/>", body.get("content").asText());
    assertEquals("51d6647ec21ad6ea", body.get("pgp_keyid").asText());
    assertEquals("Bearer token", server.requests().get(0).authorization());
  }

  @Test
  void reportsServiceError() throws Exception {
    server.route("POST", "/" + SignServerAdapter.SIGN_TASK, 200, "{\"error\": \"unknown key\"}");

    SignResult result = adapter.sign("<repomd/>", "ffff");

    assertFalse(result.succeeded());
    assertEquals(Optional.of("unknown key"), result.error());
  }

  @Test
  void listsKeysSkippingIncompleteEntries() throws Exception {
    server.route("GET", "/" + SignServerAdapter.SIGN_KEYS, 200,
        "[{\"keyid\": \"51d6647ec21ad6ea\", \"platform_id\": 1}, {\"keyid\": \"ffff\"}]");

    assertEquals(List.of(new SignKey("51d6647ec21ad6ea", 1)), adapter.listSignKeys());
  }

  @Test
  void serverErrorPropagates() {
    server.route("POST", "/" + SignServerAdapter.SIGN_TASK, 500, "{\"detail\": \"boom\"}");

    ServiceException ex = assertThrows(ServiceException.class, () -> adapter.sign("<repomd/>", "ffff"));

    assertEquals(500, ex.statusCode());
  }
}
