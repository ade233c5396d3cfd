package org.albs.exporter.infrastructure.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.application.port.CatalogPort;
import org.albs.exporter.domain.Distribution;
import org.albs.exporter.domain.Platform;
import org.albs.exporter.domain.Release;
import org.albs.exporter.domain.Release.PlannedPackage;
import org.albs.exporter.domain.Repository;
import org.albs.exporter.domain.SignKey;

/**
 * <strong>What:</strong> {@link CatalogPort} over a JSON snapshot of the build platform catalog.
 * <p>Layout:</p>
 * <pre>
 * {
 *   "platforms": [{"id": 1, "name": "AlmaLinux-8", "reference": false, "signKeys": ["51d6647ec21ad6ea"],
 *                  "repositories": [{"id": 10, "name": "almalinux-8-baseos", "arch": "x86_64", "debug": false,
 *                                    "production": true, "exportPath": "almalinux/8/BaseOS/x86_64/os",
 *                                    "pulpHref": "/pulp/api/v3/repositories/rpm/rpm/.../"}]}],
 *   "releases": [{"id": 5, "platformId": 1, "plan": {"packages": [{"fullName": "bash-5.1-1.el8.x86_64",
 *                                                  "repositories": [{"id": 10}]}]}}],
 *   "distributions": [{"id": 3, "name": "almalinux-8-extras", "repositoryIds": [10, 11]}]
 * }
 * </pre>
 * <p><strong>Thread-safety:</strong> The snapshot is parsed once and immutable afterwards.</p>
 *
 * @since 0.1.0
 */
public final class JsonCatalogAdapter implements CatalogPort {
  private final List<Platform> platforms;
  private final Map<Long, Repository> repositories;
  private final Map<Long, Release> releases;
  private final Map<String, Distribution> distributions;

  private JsonCatalogAdapter(
      List<Platform> platforms,
      Map<Long, Repository> repositories,
      Map<Long, Release> releases,
      Map<String, Distribution> distributions) {
    this.platforms = platforms;
    this.repositories = repositories;
    this.releases = releases;
    this.distributions = distributions;
  }

  /**
   * Parses a snapshot file.
   *
   * @param path snapshot location
   * @param mapper JSON mapper
   * @return catalog view
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed
   */
  public static JsonCatalogAdapter load(Path path, ObjectMapper mapper) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("catalog.path does not exist: " + path);
    }
    JsonNode root;
    try {
      root = mapper.readTree(path.toFile());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("malformed catalog " + path + ": " + ex.getOriginalMessage(), ex);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("catalog " + path + " must be a JSON object");
    }

    List<Platform> platforms = new ArrayList<>();
    Map<Long, Repository> repositories = new LinkedHashMap<>();
    for (JsonNode node : root.path("platforms")) {
      Platform platform = parsePlatform(node);
      platforms.add(platform);
      platform.repositories().forEach(repo -> repositories.put(repo.id(), repo));
    }

    Map<Long, Release> releases = new LinkedHashMap<>();
    for (JsonNode node : root.path("releases")) {
      Release release = parseRelease(node);
      releases.put(release.id(), release);
    }

    Map<String, Distribution> distributions = new LinkedHashMap<>();
    for (JsonNode node : root.path("distributions")) {
      List<Repository> members = new ArrayList<>();
      for (JsonNode id : node.path("repositoryIds")) {
        Repository repo = repositories.get(id.asLong());
        if (repo == null) {
          throw new IllegalArgumentException("distribution references unknown repository " + id.asLong());
        }
        members.add(repo);
      }
      Distribution distribution = new Distribution(
          requireLong(node, "id"), requireText(node, "name"), members);
      distributions.put(distribution.name(), distribution);
    }
    return new JsonCatalogAdapter(
        List.copyOf(platforms), Map.copyOf(repositories), Map.copyOf(releases), Map.copyOf(distributions));
  }

  @Override
  public List<Platform> platforms() {
    return platforms;
  }

  @Override
  public Optional<Platform> platform(long id) {
    return platforms.stream().filter(platform -> platform.id() == id).findFirst();
  }

  @Override
  public List<Repository> repositoriesByIds(List<Long> ids) {
    List<Repository> found = new ArrayList<>();
    for (Long id : ids) {
      Repository repo = repositories.get(id);
      if (repo != null) {
        found.add(repo);
      }
    }
    return found;
  }

  @Override
  public Optional<Release> release(long id) {
    return Optional.ofNullable(releases.get(id));
  }

  @Override
  public Optional<Distribution> distribution(String name) {
    return Optional.ofNullable(distributions.get(name));
  }

  private static Platform parsePlatform(JsonNode node) {
    long platformId = requireLong(node, "id");
    List<Repository> repos = new ArrayList<>();
    for (JsonNode repo : node.path("repositories")) {
      repos.add(new Repository(
          requireLong(repo, "id"),
          requireText(repo, "name"),
          requireText(repo, "arch"),
          repo.path("debug").asBoolean(false),
          repo.path("production").asBoolean(false),
          repo.path("exportPath").asText(""),
          requireText(repo, "pulpHref"),
          platformId));
    }
    List<SignKey> keys = new ArrayList<>();
    for (JsonNode key : node.path("signKeys")) {
      keys.add(new SignKey(key.asText(), platformId));
    }
    return new Platform(
        platformId, requireText(node, "name"), node.path("reference").asBoolean(false), repos, keys);
  }

  private static Release parseRelease(JsonNode node) {
    List<PlannedPackage> plan = new ArrayList<>();
    for (JsonNode pkg : node.path("plan").path("packages")) {
      List<Long> repoIds = new ArrayList<>();
      for (JsonNode repo : pkg.path("repositories")) {
        repoIds.add(requireLong(repo, "id"));
      }
      plan.add(new PlannedPackage(pkg.path("fullName").asText(""), repoIds));
    }
    return new Release(requireLong(node, "id"), requireLong(node, "platformId"), plan);
  }

  private static long requireLong(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (!value.canConvertToLong()) {
      throw new IllegalArgumentException("catalog entry lacks numeric " + field + ": " + node);
    }
    return value.asLong();
  }

  private static String requireText(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (!value.isTextual() || value.asText().isBlank()) {
      throw new IllegalArgumentException("catalog entry lacks " + field + ": " + node);
    }
    return value.asText();
  }
}
