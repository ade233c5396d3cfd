package org.albs.exporter.application.signature;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class SignatureLineParserTest {
  private static final String SIGNED_OUTPUT = String.join("\n",
      "Name        : bash",
      "Version     : 5.1.8",
      "Signature   : RSA/SHA256, Tue 08 Nov 2022 10:12:44 AM UTC, Key ID 51D6647EC21AD6EA",
      "Source RPM  : bash-5.1.8-6.el9.src.rpm");

  @Test
  void findsSignatureLine() {
    assertEquals(
        Optional.of("Signature   : RSA/SHA256, Tue 08 Nov 2022 10:12:44 AM UTC, Key ID 51D6647EC21AD6EA"),
        SignatureLineParser.signatureLine(SIGNED_OUTPUT));
  }

  @Test
  void extractsLowerCasedKeyId() {
    Optional<String> key = SignatureLineParser.signatureLine(SIGNED_OUTPUT).flatMap(SignatureLineParser::keyId);

    assertEquals(Optional.of("51d6647ec21ad6ea"), key);
  }

  @Test
  void reportsUnsignedPackages() {
    assertEquals(Optional.of(SignatureLineParser.UNSIGNED), SignatureLineParser.keyId("Signature   : (none)"));
  }

  @Test
  void missingLineYieldsNothing() {
    assertTrue(SignatureLineParser.signatureLine("Name : bash\nVersion : 1").isEmpty());
    assertTrue(SignatureLineParser.signatureLine("").isEmpty());
    assertTrue(SignatureLineParser.signatureLine(null).isEmpty());
    assertTrue(SignatureLineParser.keyId(null).isEmpty());
  }
}
