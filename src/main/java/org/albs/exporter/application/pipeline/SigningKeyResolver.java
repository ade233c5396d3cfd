package org.albs.exporter.application.pipeline;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.application.port.SigningPort;
import org.albs.exporter.domain.Platform;
import org.albs.exporter.domain.SignKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the key that signs a platform's repository metadata.
 *
 * <p>The signing service's own key list is authoritative and fetched once per resolver. When that
 * list cannot be fetched, the platform's catalog keys are used instead.</p>
 *
 * @since 0.1.0
 */
public final class SigningKeyResolver {
  private static final Logger log = LoggerFactory.getLogger(SigningKeyResolver.class);

  private final SigningPort signing;
  private List<SignKey> serviceKeys;
  private boolean fetched;

  public SigningKeyResolver(SigningPort signing) {
    this.signing = Objects.requireNonNull(signing, "signing");
  }

  /**
   * Resolves the signing key of a platform.
   *
   * @param platform owning platform
   * @return key identifier, empty when no key is registered
   * @throws InterruptedException when interrupted while listing keys
   */
  public Optional<String> keyFor(Platform platform) throws InterruptedException {
    Optional<List<SignKey>> keys = serviceKeys();
    List<SignKey> candidates = keys.orElse(platform.signKeys());
    return candidates.stream()
        .filter(key -> key.platformId() == platform.id())
        .map(SignKey::keyId)
        .findFirst();
  }

  private synchronized Optional<List<SignKey>> serviceKeys() throws InterruptedException {
    if (!fetched) {
      try {
        serviceKeys = List.copyOf(signing.listSignKeys());
      } catch (IOException ex) {
        log.warn("Cannot list sign keys, falling back to catalog keys: {}", ex.getMessage());
        serviceKeys = null;
      }
      fetched = true;
    }
    return Optional.ofNullable(serviceKeys);
  }
}
