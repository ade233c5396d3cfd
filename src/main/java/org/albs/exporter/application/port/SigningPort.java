package org.albs.exporter.application.port;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.domain.SignKey;

/**
 * <strong>What:</strong> Remote detached-signature service.
 * <p><strong>Role:</strong> Port implemented by {@code SignServerAdapter}.</p>
 * <p><strong>Errors:</strong> Transport failures and rejected requests surface as {@link IOException}; a
 * signing refusal reported in the response body is returned as a failed {@link SignResult}.</p>
 *
 * @since 0.1.0
 */
public interface SigningPort {

  /**
   * Requests an ASCII-armored detached signature.
   *
   * @param content text to sign
   * @param keyId signing key identifier
   * @return signature or the service's error message
   */
  SignResult sign(String content, String keyId) throws IOException, InterruptedException;

  /**
   * Lists keys known to the signing service.
   *
   * @return sign keys with their owning platform
   */
  List<SignKey> listSignKeys() throws IOException, InterruptedException;

  /**
   * Outcome of one signing request; exactly one of the fields is present.
   *
   * @param signature armored signature
   * @param error error reported by the service
   */
  record SignResult(Optional<String> signature, Optional<String> error) {
    public SignResult {
      signature = Objects.requireNonNullElse(signature, Optional.empty());
      error = Objects.requireNonNullElse(error, Optional.empty());
      if (signature.isPresent() == error.isPresent()) {
        throw new IllegalArgumentException("exactly one of signature or error must be present");
      }
    }

    public static SignResult signed(String signature) {
      return new SignResult(Optional.of(signature), Optional.empty());
    }

    public static SignResult failed(String error) {
      return new SignResult(Optional.empty(), Optional.of(error == null ? "unknown error" : error));
    }

    public boolean succeeded() {
      return signature.isPresent();
    }
  }
}
