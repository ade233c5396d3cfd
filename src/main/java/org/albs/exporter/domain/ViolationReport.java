package org.albs.exporter.domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Signature violations collected while scanning one exported directory.
 * <p><strong>Why:</strong> Violations are data, reported at the end of a run instead of aborting it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep inspection failures, unsigned packages and wrong-key packages in disjoint sets.</li>
 *   <li>Remember the authorized keys the directory was checked against.</li>
 *   <li>Render itself in the plaintext error-log format.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutators and readers synchronize on the report; safe for concurrent
 * appends. Readers receive snapshots.</p>
 *
 * @since 0.1.0
 */
public final class ViolationReport {
  static final String INSPECTION_FAILED_HEADER = "Packages that we cannot get information about:";
  static final String UNSIGNED_HEADER = "Packages without signature:";
  static final String WRONG_KEY_HEADER = "Packages with wrong signature:";

  private final Path directory;
  private final Set<String> authorizedKeys;
  private final Set<Path> inspectionFailed = new LinkedHashSet<>();
  private final Set<Path> unsigned = new LinkedHashSet<>();
  private final Map<Path, String> wrongKey = new LinkedHashMap<>();

  public ViolationReport(Path directory, Set<String> authorizedKeys) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.authorizedKeys = Set.copyOf(Objects.requireNonNull(authorizedKeys, "authorizedKeys"));
  }

  public Path directory() {
    return directory;
  }

  public Set<String> authorizedKeys() {
    return authorizedKeys;
  }

  public synchronized void inspectionFailed(Path file) {
    clear(file);
    inspectionFailed.add(file);
  }

  public synchronized void unsigned(Path file) {
    clear(file);
    unsigned.add(file);
  }

  public synchronized void wrongKey(Path file, String keyId) {
    clear(file);
    wrongKey.put(file, Objects.requireNonNull(keyId, "keyId"));
  }

  public synchronized Set<Path> inspectionFailedFiles() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(inspectionFailed));
  }

  public synchronized Set<Path> unsignedFiles() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(unsigned));
  }

  public synchronized Map<Path, String> wrongKeyFiles() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(wrongKey));
  }

  public synchronized boolean isEmpty() {
    return inspectionFailed.isEmpty() && unsigned.isEmpty() && wrongKey.isEmpty();
  }

  public synchronized int violationCount() {
    return inspectionFailed.size() + unsigned.size() + wrongKey.size();
  }

  /**
   * Renders the non-empty sections in the error-log layout.
   *
   * @return section headers each followed by their entries; empty when there are no violations
   */
  public synchronized List<String> toLogLines() {
    List<String> lines = new ArrayList<>();
    if (!inspectionFailed.isEmpty()) {
      lines.add(INSPECTION_FAILED_HEADER);
      inspectionFailed.forEach(path -> lines.add(path.toString()));
    }
    if (!unsigned.isEmpty()) {
      lines.add(UNSIGNED_HEADER);
      unsigned.forEach(path -> lines.add(path.toString()));
    }
    if (!wrongKey.isEmpty()) {
      lines.add(WRONG_KEY_HEADER);
      wrongKey.forEach((path, key) -> lines.add(path + " " + key));
    }
    return lines;
  }

  // a file is classified once; a later classification replaces the earlier one
  private void clear(Path file) {
    Objects.requireNonNull(file, "file");
    inspectionFailed.remove(file);
    unsigned.remove(file);
    wrongKey.remove(file);
  }

  @Override
  public synchronized String toString() {
    return "ViolationReport{directory=" + directory
        + ", inspectionFailed=" + inspectionFailed.size()
        + ", unsigned=" + unsigned.size()
        + ", wrongKey=" + wrongKey.size() + '}';
  }
}
