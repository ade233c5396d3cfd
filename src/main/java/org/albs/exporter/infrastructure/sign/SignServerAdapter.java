package org.albs.exporter.infrastructure.sign;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.albs.exporter.application.port.ServiceException;
import org.albs.exporter.application.port.SigningPort;
import org.albs.exporter.domain.SignKey;
import org.albs.exporter.infrastructure.http.JsonHttpClient;

/**
 * {@link SigningPort} backed by the sign server's synchronous signing endpoint.
 *
 * @since 0.1.0
 */
public final class SignServerAdapter implements SigningPort {
  static final String SERVICE = "sign";
  static final String SIGN_TASK = "sign-tasks/sync_sign_task/";
  static final String SIGN_KEYS = "sign-keys/";

  private final JsonHttpClient http;

  public SignServerAdapter(JsonHttpClient http) {
    this.http = Objects.requireNonNull(http, "http");
  }

  @Override
  public SignResult sign(String content, String keyId) throws IOException, InterruptedException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("content", content);
    body.put("pgp_keyid", keyId);
    JsonNode response = http.post(SIGN_TASK, body);
    JsonNode signature = response.path("asc_content");
    if (signature.isTextual() && !signature.asText().isEmpty()) {
      return SignResult.signed(signature.asText());
    }
    JsonNode error = response.path("error");
    return SignResult.failed(error.isMissingNode() || error.isNull() ? "empty response" : error.asText());
  }

  @Override
  public List<SignKey> listSignKeys() throws IOException, InterruptedException {
    JsonNode response = http.get(SIGN_KEYS);
    if (!response.isArray()) {
      throw new ServiceException(SERVICE, "sign keys response is not a list", null);
    }
    List<SignKey> keys = new ArrayList<>();
    for (JsonNode node : response) {
      JsonNode keyId = node.path("keyid");
      JsonNode platformId = node.path("platform_id");
      if (!keyId.isTextual() || !platformId.canConvertToLong()) {
        continue;
      }
      keys.add(new SignKey(keyId.asText(), platformId.asLong()));
    }
    return keys;
  }
}
