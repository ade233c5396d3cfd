package org.albs.exporter.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.application.port.ServiceException;
import org.albs.exporter.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Minimal JSON-over-HTTP client shared by the service adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve relative paths and absolute hrefs against the service base URI.</li>
 *   <li>Attach the configured {@code Authorization} header and a per-request timeout.</li>
 *   <li>Map statuses of 400 and above to {@link ServiceException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; the underlying {@link HttpClient} is thread-safe.</p>
 * <p><strong>Security:</strong> The authorization value is never logged.</p>
 *
 * @since 0.1.0
 */
public final class JsonHttpClient {
  private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);
  private static final int MAX_ERROR_BODY_BYTES = 512;

  private final String service;
  private final URI baseUri;
  private final HttpClient client;
  private final ObjectMapper mapper;
  private final Duration requestTimeout;
  private final Optional<String> authorization;

  public JsonHttpClient(
      String service,
      URI baseUri,
      HttpClient client,
      ObjectMapper mapper,
      Duration requestTimeout,
      Optional<String> authorization) {
    this.service = Objects.requireNonNull(service, "service");
    this.baseUri = withTrailingSlash(Objects.requireNonNull(baseUri, "baseUri"));
    this.client = Objects.requireNonNull(client, "client");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.authorization = Objects.requireNonNullElse(authorization, Optional.empty());
  }

  public JsonNode get(String target) throws IOException, InterruptedException {
    return send("GET", target, HttpRequest.BodyPublishers.noBody());
  }

  public JsonNode post(String target, Object body) throws IOException, InterruptedException {
    byte[] payload = mapper.writeValueAsBytes(body);
    return send("POST", target, HttpRequest.BodyPublishers.ofByteArray(payload));
  }

  public JsonNode delete(String target) throws IOException, InterruptedException {
    return send("DELETE", target, HttpRequest.BodyPublishers.noBody());
  }

  /**
   * Resolves a path or href.
   *
   * @param target absolute URL, absolute path ({@code /pulp/api/v3/...}) or path relative to the base
   * @return absolute URI
   */
  public URI resolve(String target) {
    Objects.requireNonNull(target, "target");
    if (target.startsWith("http://") || target.startsWith("https://")) {
      return URI.create(target);
    }
    return baseUri.resolve(target);
  }

  private JsonNode send(String method, String target, HttpRequest.BodyPublisher body)
      throws IOException, InterruptedException {
    URI uri = resolve(target);
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
        .timeout(requestTimeout)
        .header("Accept", "application/json")
        .method(method, body);
    if (!"GET".equals(method) && !"DELETE".equals(method)) {
      builder.header("Content-Type", "application/json");
    }
    authorization.ifPresent(value -> builder.header("Authorization", value));

    log.debug("{} {} {}", service, method, uri);
    HttpResponse<byte[]> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    int status = response.statusCode();
    byte[] payload = response.body() == null ? new byte[0] : response.body();
    if (status >= 400) {
      String detail = Logs.truncate(new String(payload, StandardCharsets.UTF_8), MAX_ERROR_BODY_BYTES);
      throw new ServiceException(service, status, method + " " + uri.getPath() + " returned " + status
          + (detail.isBlank() ? "" : ": " + detail));
    }
    if (payload.length == 0) {
      return MissingNode.getInstance();
    }
    try {
      return mapper.readTree(payload);
    } catch (IOException ex) {
      throw new ServiceException(service, "malformed JSON from " + uri.getPath(), ex);
    }
  }

  private static URI withTrailingSlash(URI uri) {
    String raw = uri.toString();
    return raw.endsWith("/") ? uri : URI.create(raw + '/');
  }
}
