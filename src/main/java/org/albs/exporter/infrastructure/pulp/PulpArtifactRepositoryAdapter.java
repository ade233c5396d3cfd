package org.albs.exporter.infrastructure.pulp;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.albs.exporter.application.port.ArtifactRepositoryPort;
import org.albs.exporter.application.port.ServiceException;
import org.albs.exporter.domain.PackageRecord;
import org.albs.exporter.infrastructure.http.JsonHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArtifactRepositoryPort} backed by the Pulp 3 REST API.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Follow {@code next} links until a listing is exhausted.</li>
 *   <li>Poll asynchronous tasks until they reach a final state.</li>
 *   <li>Translate failed or cancelled tasks into {@link ServiceException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared HTTP client; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class PulpArtifactRepositoryAdapter implements ArtifactRepositoryPort {
  static final String SERVICE = "pulp";
  static final String API_ROOT = "/pulp/api/v3/";
  static final String EXPORTERS = API_ROOT + "exporters/core/filesystem/";
  static final String PACKAGES = API_ROOT + "content/rpm/packages/";
  static final String PUBLICATIONS = API_ROOT + "publications/rpm/rpm/";

  private static final Logger log = LoggerFactory.getLogger(PulpArtifactRepositoryAdapter.class);
  private static final int PAGE_SIZE = 1000;

  private final JsonHttpClient http;
  private final Duration pollInterval;
  private final Duration taskTimeout;

  public PulpArtifactRepositoryAdapter(JsonHttpClient http, Duration pollInterval, Duration taskTimeout) {
    this.http = Objects.requireNonNull(http, "http");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.taskTimeout = Objects.requireNonNull(taskTimeout, "taskTimeout");
  }

  @Override
  public String createFilesystemExporter(String name, String path) throws IOException, InterruptedException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", name);
    body.put("path", path);
    body.put("method", "hardlink");
    JsonNode created = http.post(EXPORTERS, body);
    return requireText(created, "pulp_href");
  }

  @Override
  public void deleteFilesystemExporter(String exporterHref) throws IOException, InterruptedException {
    JsonNode response = http.delete(exporterHref);
    if (response.hasNonNull("task")) {
      waitForTask(response.get("task").asText());
    }
  }

  @Override
  public List<FilesystemExporter> listFilesystemExporters() throws IOException, InterruptedException {
    List<FilesystemExporter> exporters = new ArrayList<>();
    for (JsonNode node : listAll(EXPORTERS + "?limit=" + PAGE_SIZE)) {
      exporters.add(new FilesystemExporter(node.path("name").asText(""), requireText(node, "pulp_href")));
    }
    return exporters;
  }

  @Override
  public String getLatestVersion(String repositoryHref) throws IOException, InterruptedException {
    return requireText(http.get(repositoryHref), "latest_version_href");
  }

  @Override
  public void exportToFilesystem(String exporterHref, String versionHref) throws IOException, InterruptedException {
    JsonNode response = http.post(exporterHref + "exports/", Map.of("repository_version", versionHref));
    waitForTask(requireText(response, "task"));
  }

  @Override
  public List<PackageRecord> listPackages(PackageFilter filter) throws IOException, InterruptedException {
    StringBuilder query = new StringBuilder(PACKAGES)
        .append("?repository_version=").append(encode(filter.versionHref()))
        .append("&fields=").append(encode(String.join(",", filter.fields())))
        .append("&limit=").append(PAGE_SIZE);
    if (filter.arch() != null && !filter.arch().isBlank()) {
      query.append("&arch=").append(encode(filter.arch()));
    }
    List<PackageRecord> packages = new ArrayList<>();
    for (JsonNode node : listAll(query.toString())) {
      packages.add(new PackageRecord(
          requireText(node, "name"),
          requireText(node, "version"),
          requireText(node, "release"),
          node.path("arch").asText(filter.arch()),
          node.path("sha256").asText(""),
          requireText(node, "pulp_href")));
    }
    return packages;
  }

  @Override
  public void modifyContent(String repositoryHref, List<String> add, List<String> remove)
      throws IOException, InterruptedException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("add_content_units", List.copyOf(add));
    body.put("remove_content_units", List.copyOf(remove));
    JsonNode response = http.post(repositoryHref + "modify/", body);
    waitForTask(requireText(response, "task"));
  }

  @Override
  public String createPublication(String repositoryHref) throws IOException, InterruptedException {
    JsonNode response = http.post(PUBLICATIONS, Map.of("repository", repositoryHref));
    JsonNode task = waitForTask(requireText(response, "task"));
    JsonNode created = task.path("created_resources");
    if (!created.isArray() || created.isEmpty()) {
      throw new ServiceException(SERVICE, "publication task created no resources for " + repositoryHref, null);
    }
    return created.get(0).asText();
  }

  @Override
  public Optional<String> findLatestPublication(String versionHref) throws IOException, InterruptedException {
    JsonNode page = http.get(PUBLICATIONS + "?repository_version=" + encode(versionHref)
        + "&ordering=-pulp_created&limit=1");
    JsonNode results = page.path("results");
    if (!results.isArray() || results.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(requireText(results.get(0), "pulp_href"));
  }

  /**
   * Polls a task until it completes.
   *
   * @param taskHref task handle
   * @return final task document
   * @throws ServiceException when the task fails, is cancelled or outlives the task timeout
   */
  JsonNode waitForTask(String taskHref) throws IOException, InterruptedException {
    long deadline = System.nanoTime() + taskTimeout.toNanos();
    while (true) {
      JsonNode task = http.get(taskHref);
      String state = task.path("state").asText("").toLowerCase(Locale.ROOT);
      switch (state) {
        case "completed":
          return task;
        case "failed":
        case "canceled":
          throw new ServiceException(SERVICE, "task " + taskHref + " " + state + describeError(task), null);
        default:
          break;
      }
      if (System.nanoTime() > deadline) {
        throw new ServiceException(SERVICE, "task " + taskHref + " still " + state + " after " + taskTimeout, null);
      }
      TimeUnit.MILLISECONDS.sleep(pollInterval.toMillis());
    }
  }

  private List<JsonNode> listAll(String firstPage) throws IOException, InterruptedException {
    List<JsonNode> items = new ArrayList<>();
    String next = firstPage;
    int pages = 0;
    while (next != null) {
      JsonNode page = http.get(next);
      page.path("results").forEach(items::add);
      JsonNode nextNode = page.path("next");
      next = nextNode.isTextual() && !nextNode.asText().isBlank() ? nextNode.asText() : null;
      pages++;
    }
    log.debug("Listed {} items over {} pages from {}", items.size(), pages, firstPage);
    return items;
  }

  private static String describeError(JsonNode task) {
    JsonNode error = task.path("error");
    if (error.isMissingNode() || error.isNull()) {
      return "";
    }
    JsonNode description = error.path("description");
    return ": " + (description.isTextual() ? description.asText() : error.toString());
  }

  private static String requireText(JsonNode node, String field) throws ServiceException {
    JsonNode value = node.path(field);
    if (!value.isTextual() || value.asText().isBlank()) {
      throw new ServiceException(SERVICE, "response lacks " + field, null);
    }
    return value.asText();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
