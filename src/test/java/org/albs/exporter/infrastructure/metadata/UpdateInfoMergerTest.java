package org.albs.exporter.infrastructure.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

class UpdateInfoMergerTest {
  private static final String SOURCE = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
      + "<updates>\n"
      + update("ALSA-2024:0001", "bash-5.1.8-9.el9.x86_64.rpm", "bash-doc-5.1.8-9.el9.noarch.rpm")
      + update("ALSA-2024:0002", "kernel-5.14.0-1.el9.x86_64.rpm")
      + update("ALSA-2024:0003", "openssl-3.0.7-1.el9.x86_64.rpm")
      + "</updates>\n";

  @TempDir
  Path root;

  private Path source;
  private Path repodata;
  private final UpdateInfoMerger merger = new UpdateInfoMerger();

  @BeforeEach
  void setUp() throws IOException {
    Path sourceRepodata = Files.createDirectories(root.resolve("x86_64/os/repodata"));
    source = sourceRepodata.resolve("abc-updateinfo.xml.gz");
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(source))) {
      out.write(SOURCE.getBytes(StandardCharsets.UTF_8));
    }
    repodata = Files.createDirectories(root.resolve("ppc64le/os/repodata"));
    Path packages = Files.createDirectories(root.resolve("ppc64le/os/Packages"));
    Files.writeString(packages.resolve("bash-5.1.8-9.el9.ppc64le.rpm"), "");
    Files.writeString(packages.resolve("bash-doc-5.1.8-9.el9.noarch.rpm"), "");
    Files.writeString(packages.resolve("openssl-3.0.7-1.el9.ppc64le.rpm"), "");
  }

  @Test
  void retargetsPackagesAndDropsUpdatesWithoutContent() throws Exception {
    Path output = repodata.resolve("updateinfo.xml");

    merger.merge(source, repodata, output);

    Document merged = parse(output);
    assertEquals(List.of("ALSA-2024:0001", "ALSA-2024:0003"), ids(merged));
    assertEquals(List.of("bash-5.1.8-9.el9.ppc64le.rpm", "bash-doc-5.1.8-9.el9.noarch.rpm",
        "openssl-3.0.7-1.el9.ppc64le.rpm"), texts(merged, "filename"));
    NodeList packages = merged.getElementsByTagName("package");
    assertEquals("ppc64le", ((Element) packages.item(0)).getAttribute("arch"));
    assertEquals("noarch", ((Element) packages.item(1)).getAttribute("arch"));
  }

  @Test
  void keepsTargetUpdatesAndSkipsDuplicates() throws Exception {
    Files.writeString(repodata.resolve("def-updateinfo.xml"), "<updates>\n"
        + update("ALSA-2024:0003", "openssl-3.0.7-1.el9.ppc64le.rpm").replace("x86_64\"", "ppc64le\"")
        + "</updates>\n");
    Path output = repodata.resolve("updateinfo.xml");

    merger.merge(source, repodata, output);

    assertEquals(List.of("ALSA-2024:0003", "ALSA-2024:0001"), ids(parse(output)));
  }

  @Test
  void acceptsPlainSource() throws Exception {
    Path plain = Files.writeString(root.resolve("updateinfo.xml"), SOURCE);
    Path output = repodata.resolve("updateinfo.xml");

    merger.merge(plain, repodata, output);

    assertEquals(2, ids(parse(output)).size());
  }

  @Test
  void rejectsUnsupportedCompression() throws Exception {
    Path zst = Files.writeString(root.resolve("updateinfo.xml.zst"), "");

    IOException ex = assertThrows(IOException.class,
        () -> merger.merge(zst, repodata, repodata.resolve("updateinfo.xml")));
    assertTrue(ex.getMessage().contains("unsupported errata compression"));
  }

  @Test
  void rejectsDoctypeDeclarations() throws Exception {
    Path hostile = Files.writeString(root.resolve("hostile.xml"),
        "<?xml version=\"1.0\"?><!DOCTYPE updates [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><updates>&x;</updates>");

    assertThrows(IOException.class, () -> merger.merge(hostile, repodata, repodata.resolve("updateinfo.xml")));
  }

  private static String update(String id, String... files) {
    StringBuilder xml = new StringBuilder("  <update from=\"packager@almalinux.org\" type=\"security\">\n")
        .append("    <id>").append(id).append("</id>\n")
        .append("    <pkglist><collection short=\"almalinux-9\">\n");
    for (String file : files) {
      String arch = file.endsWith(".noarch.rpm") ? "noarch" : "x86_64";
      xml.append("      <package arch=\"").append(arch).append("\" name=\"n\" version=\"1\" release=\"1\">")
          .append("<filename>").append(file).append("</filename></package>\n");
    }
    return xml.append("    </collection></pkglist>\n  </update>\n").toString();
  }

  private static Document parse(Path file) throws Exception {
    return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(file.toFile());
  }

  private static List<String> ids(Document document) {
    return texts(document, "id");
  }

  private static List<String> texts(Document document, String tag) {
    List<String> values = new ArrayList<>();
    NodeList nodes = document.getElementsByTagName(tag);
    for (int i = 0; i < nodes.getLength(); i++) {
      values.add(nodes.item(i).getTextContent().trim());
    }
    return values;
  }
}
