package org.albs.exporter.application.signature;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Delegation from a primary signing key to the subkeys allowed to sign in its name.
 *
 * <p>Identifiers are compared lower-cased.</p>
 *
 * @since 0.1.0
 */
public final class KnownSubkeys {
  private static final KnownSubkeys EMPTY = new KnownSubkeys(Map.of());

  private final Map<String, Set<String>> subkeysByOwner;

  private KnownSubkeys(Map<String, Set<String>> subkeysByOwner) {
    this.subkeysByOwner = subkeysByOwner;
  }

  public static KnownSubkeys empty() {
    return EMPTY;
  }

  /**
   * Builds a delegation map.
   *
   * @param raw owner key to subkeys
   * @return normalized, immutable mapping
   */
  public static KnownSubkeys of(Map<String, ? extends Collection<String>> raw) {
    Objects.requireNonNull(raw, "raw");
    Map<String, Set<String>> normalized = new LinkedHashMap<>();
    raw.forEach((owner, subkeys) -> {
      Set<String> keys = new LinkedHashSet<>();
      if (subkeys != null) {
        subkeys.stream().filter(Objects::nonNull).map(KnownSubkeys::normalize).forEach(keys::add);
      }
      normalized.merge(normalize(owner), keys, (left, right) -> {
        Set<String> merged = new LinkedHashSet<>(left);
        merged.addAll(right);
        return merged;
      });
    });
    normalized.replaceAll((owner, keys) -> Set.copyOf(keys));
    return new KnownSubkeys(Map.copyOf(normalized));
  }

  /**
   * Tells whether {@code keyId} is a subkey of one of the authorized owners.
   *
   * @param authorizedOwners lower-cased authorized primary keys
   * @param keyId lower-cased key identifier from a package header
   * @return {@code true} when delegation applies
   */
  public boolean delegates(Set<String> authorizedOwners, String keyId) {
    for (String owner : authorizedOwners) {
      Set<String> subkeys = subkeysByOwner.get(owner);
      if (subkeys != null && subkeys.contains(keyId)) {
        return true;
      }
    }
    return false;
  }

  public boolean isEmpty() {
    return subkeysByOwner.isEmpty();
  }

  public int size() {
    return subkeysByOwner.size();
  }

  private static String normalize(String key) {
    return Objects.requireNonNull(key, "key").trim().toLowerCase(Locale.ROOT);
  }
}
