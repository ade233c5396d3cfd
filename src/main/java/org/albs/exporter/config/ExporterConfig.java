package org.albs.exporter.config;

import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.application.noarch.NoarchMode;
import org.albs.exporter.logging.Logs;
import org.albs.exporter.validation.Numbers;
import org.albs.exporter.validation.Strings;
import org.albs.exporter.validation.Urls;

/**
 * <strong>What:</strong> Bound, validated settings of one exporter run.
 * <p><strong>Why:</strong> Keeps the composition root free of string parsing; every value arriving from YAML
 * or the command line is checked once, here.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 * <p><strong>Security:</strong> {@link #toString()} redacts the repository password and signing token.</p>
 *
 * @since 0.1.0
 */
public final class ExporterConfig {
  static final int MAX_WORKERS = 64;
  static final int MAX_USER_LENGTH = 150;
  static final long MAX_TIMEOUT_SECONDS = 86_400;

  private final URI pulpUrl;
  private final String pulpUser;
  private final String pulpPassword;
  private final Optional<URI> signUrl;
  private final String signToken;
  private final Path exportRoot;
  private final Path errorLog;
  private final Path knownSubkeys;
  private final Path catalogPath;
  private final int workers;
  private final boolean includePublications;
  private final NoarchMode noarchMode;
  private final boolean differOnly;
  private final String operator;
  private final String serviceOwner;
  private final Duration httpTimeout;
  private final Duration toolTimeout;
  private final Duration taskTimeout;
  private final Duration pollInterval;
  private final boolean useSudo;

  private ExporterConfig(Builder builder) {
    this.pulpUrl = builder.pulpUrl;
    this.pulpUser = builder.pulpUser;
    this.pulpPassword = builder.pulpPassword;
    this.signUrl = builder.signUrl;
    this.signToken = builder.signToken;
    this.exportRoot = builder.exportRoot;
    this.errorLog = builder.errorLog;
    this.knownSubkeys = builder.knownSubkeys;
    this.catalogPath = builder.catalogPath;
    this.workers = builder.workers;
    this.includePublications = builder.includePublications;
    this.noarchMode = builder.noarchMode;
    this.differOnly = builder.differOnly;
    this.operator = builder.operator;
    this.serviceOwner = builder.serviceOwner;
    this.httpTimeout = builder.httpTimeout;
    this.toolTimeout = builder.toolTimeout;
    this.taskTimeout = builder.taskTimeout;
    this.pollInterval = builder.pollInterval;
    this.useSudo = builder.useSudo;
  }

  /**
   * Binds an effective configuration map produced by {@link ConfigMerger}.
   *
   * @param args flattened key/value settings
   * @return validated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is invalid
   */
  public static ExporterConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Builder builder = new Builder();
    builder.pulpUrl = Urls.requireHttpUrl("pulp.host", required(args, "pulp.host"));
    builder.pulpUser = Strings.requirePrintableAscii("pulp.user", required(args, "pulp.user"), MAX_USER_LENGTH);
    builder.pulpPassword = args.getOrDefault("pulp.password", "");
    builder.signUrl = optional(args, "sign.url").map(raw -> Urls.requireHttpUrl("sign.url", raw));
    builder.signToken = args.getOrDefault("sign.token", "");
    builder.exportRoot = path("export.root", required(args, "export.root"));
    builder.errorLog = path("export.errorLog", required(args, "export.errorLog"));
    builder.knownSubkeys = path("export.knownSubkeys", required(args, "export.knownSubkeys"));
    builder.catalogPath = path("catalog.path", required(args, "catalog.path"));
    builder.workers = (int) Numbers.parseInRange("export.workers", args.get("export.workers"), 1, MAX_WORKERS);
    builder.includePublications = parseBoolean(args.get("export.includePublications"));
    builder.noarchMode = NoarchMode.fromString(args.get("noarch.mode"));
    builder.differOnly = parseBoolean(args.get("noarch.differOnly"));
    builder.operator = Strings.requireAccountName("owner.operator", required(args, "owner.operator"));
    builder.serviceOwner = Strings.requireAccountName("owner.service", required(args, "owner.service"));
    builder.httpTimeout = seconds(args, "http.timeoutSeconds");
    builder.toolTimeout = seconds(args, "tools.timeoutSeconds");
    builder.taskTimeout = seconds(args, "pulp.taskTimeoutSeconds");
    builder.pollInterval = Duration.ofMillis(
        Numbers.parseInRange("pulp.pollMillis", args.get("pulp.pollMillis"), 10, 60_000));
    builder.useSudo = parseBoolean(args.get("tools.sudo"));
    return new ExporterConfig(builder);
  }

  public URI pulpUrl() {
    return pulpUrl;
  }

  public String pulpUser() {
    return pulpUser;
  }

  public String pulpPassword() {
    return pulpPassword;
  }

  public Optional<URI> signUrl() {
    return signUrl;
  }

  public String signToken() {
    return signToken;
  }

  public Path exportRoot() {
    return exportRoot;
  }

  public Path errorLog() {
    return errorLog;
  }

  public Path knownSubkeys() {
    return knownSubkeys;
  }

  public Path catalogPath() {
    return catalogPath;
  }

  public int workers() {
    return workers;
  }

  public boolean includePublications() {
    return includePublications;
  }

  public NoarchMode noarchMode() {
    return noarchMode;
  }

  public boolean differOnly() {
    return differOnly;
  }

  public String operator() {
    return operator;
  }

  public String serviceOwner() {
    return serviceOwner;
  }

  public Duration httpTimeout() {
    return httpTimeout;
  }

  public Duration toolTimeout() {
    return toolTimeout;
  }

  public Duration taskTimeout() {
    return taskTimeout;
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public boolean useSudo() {
    return useSudo;
  }

  private static String required(Map<String, String> args, String key) {
    return optional(args, key)
        .orElseThrow(() -> new IllegalArgumentException(key + " is required"));
  }

  private static Optional<String> optional(Map<String, String> args, String key) {
    return Optional.ofNullable(args.get(key)).map(String::trim).filter(value -> !value.isEmpty());
  }

  private static Path path(String key, String raw) {
    String value = raw;
    if (value.equals("~") || value.startsWith("~/")) {
      value = System.getProperty("user.home", ".") + value.substring(1);
    }
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static Duration seconds(Map<String, String> args, String key) {
    return Duration.ofSeconds(Numbers.parseInRange(key, args.get(key), 1, MAX_TIMEOUT_SECONDS));
  }

  private static boolean parseBoolean(String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    String value = raw.trim();
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false but was " + value);
  }

  @Override
  public String toString() {
    return "ExporterConfig{pulpUrl=" + pulpUrl
        + ", pulpUser=" + pulpUser
        + ", pulpPassword=" + Logs.redact(pulpPassword)
        + ", signUrl=" + signUrl.map(URI::toString).orElse("<none>")
        + ", signToken=" + Logs.redact(signToken)
        + ", exportRoot=" + exportRoot
        + ", errorLog=" + errorLog
        + ", knownSubkeys=" + knownSubkeys
        + ", catalogPath=" + catalogPath
        + ", workers=" + workers
        + ", includePublications=" + includePublications
        + ", noarchMode=" + noarchMode
        + ", differOnly=" + differOnly
        + ", operator=" + operator
        + ", serviceOwner=" + serviceOwner
        + ", httpTimeout=" + httpTimeout
        + ", toolTimeout=" + toolTimeout
        + ", taskTimeout=" + taskTimeout
        + ", pollInterval=" + pollInterval
        + ", useSudo=" + useSudo + '}';
  }

  private static final class Builder {
    private URI pulpUrl;
    private String pulpUser;
    private String pulpPassword;
    private Optional<URI> signUrl;
    private String signToken;
    private Path exportRoot;
    private Path errorLog;
    private Path knownSubkeys;
    private Path catalogPath;
    private int workers;
    private boolean includePublications;
    private NoarchMode noarchMode;
    private boolean differOnly;
    private String operator;
    private String serviceOwner;
    private Duration httpTimeout;
    private Duration toolTimeout;
    private Duration taskTimeout;
    private Duration pollInterval;
    private boolean useSudo;
  }
}
