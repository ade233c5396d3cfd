package org.albs.exporter.infrastructure.metadata;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.albs.exporter.application.port.ErrataMergePort;
import org.albs.exporter.domain.Architectures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * <strong>What:</strong> Carries {@code x86_64} errata over to a {@code ppc64le} repository.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Updates already present in the target keep their target definition.</li>
 *   <li>Package entries are retargeted from {@code x86_64} to {@code ppc64le}; {@code noarch} entries
 *   are kept as they are.</li>
 *   <li>Package entries whose file is absent from the target {@code Packages} directory are dropped,
 *   as are updates left without packages.</li>
 * </ul>
 * <p><strong>Security:</strong> Document type declarations are rejected.</p>
 *
 * @since 0.1.0
 */
public final class UpdateInfoMerger implements ErrataMergePort {
  private static final Logger log = LoggerFactory.getLogger(UpdateInfoMerger.class);
  private static final String PACKAGES_DIR = "Packages";

  @Override
  public void merge(Path sourceUpdateInfo, Path targetRepodata, Path output) throws IOException {
    Document source = parse(sourceUpdateInfo);
    Optional<Path> existing = findExisting(targetRepodata, output);
    Document target = existing.isPresent() ? parse(existing.get()) : newDocument();
    Element targetRoot = target.getDocumentElement();
    if (targetRoot == null) {
      targetRoot = target.createElement("updates");
      target.appendChild(targetRoot);
    }

    Set<String> existingIds = new HashSet<>();
    for (Element update : children(targetRoot, "update")) {
      existingIds.add(updateId(update));
    }
    Set<String> available = packageFiles(targetRepodata.toAbsolutePath().getParent());

    int merged = 0;
    for (Element update : children(source.getDocumentElement(), "update")) {
      String id = updateId(update);
      if (existingIds.contains(id)) {
        continue;
      }
      Element copy = (Element) target.importNode(update, true);
      if (retarget(copy, available) == 0) {
        continue;
      }
      targetRoot.appendChild(copy);
      existingIds.add(id);
      merged++;
    }
    write(target, output);
    log.debug("Merged {} updates from {} into {}", merged, sourceUpdateInfo, output);
  }

  private static int retarget(Element update, Set<String> available) {
    int kept = 0;
    for (Element pkglist : children(update, "pkglist")) {
      for (Element collection : children(pkglist, "collection")) {
        for (Element pkg : children(collection, "package")) {
          if (Architectures.X86_64.equals(pkg.getAttribute("arch"))) {
            pkg.setAttribute("arch", Architectures.PPC64LE);
          }
          String fileName = retargetFilename(pkg);
          if (fileName.isEmpty() || !available.contains(fileName)) {
            collection.removeChild(pkg);
          } else {
            kept++;
          }
        }
      }
    }
    return kept;
  }

  private static String retargetFilename(Element pkg) {
    List<Element> names = children(pkg, "filename");
    if (names.isEmpty()) {
      return "";
    }
    Element filename = names.get(0);
    String value = filename.getTextContent().trim()
        .replace("." + Architectures.X86_64 + ".rpm", "." + Architectures.PPC64LE + ".rpm");
    filename.setTextContent(value);
    return value;
  }

  private static String updateId(Element update) {
    List<Element> ids = children(update, "id");
    return ids.isEmpty() ? "" : ids.get(0).getTextContent().trim();
  }

  private static Set<String> packageFiles(Path repositoryDirectory) throws IOException {
    Set<String> names = new HashSet<>();
    if (repositoryDirectory == null) {
      return names;
    }
    Path packages = repositoryDirectory.resolve(PACKAGES_DIR);
    if (!Files.isDirectory(packages)) {
      return names;
    }
    try (Stream<Path> files = Files.list(packages)) {
      files.map(path -> path.getFileName().toString()).forEach(names::add);
    }
    return names;
  }

  private static Optional<Path> findExisting(Path repodata, Path output) throws IOException {
    if (!Files.isDirectory(repodata)) {
      return Optional.empty();
    }
    PathMatcher matcher = repodata.getFileSystem().getPathMatcher("glob:*updateinfo.xml*");
    Path normalizedOutput = output.toAbsolutePath().normalize();
    try (Stream<Path> files = Files.list(repodata)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> matcher.matches(path.getFileName()))
          .filter(path -> !path.toAbsolutePath().normalize().equals(normalizedOutput))
          .sorted()
          .findFirst();
    }
  }

  private static List<Element> children(Element parent, String name) {
    List<Element> elements = new ArrayList<>();
    if (parent == null) {
      return elements;
    }
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
        elements.add((Element) node);
      }
    }
    return elements;
  }

  private static Document parse(Path file) throws IOException {
    try (InputStream in = open(file)) {
      return builder().parse(in);
    } catch (SAXException ex) {
      throw new IOException("malformed errata document " + file + ": " + ex.getMessage(), ex);
    }
  }

  private static InputStream open(Path file) throws IOException {
    String name = file.getFileName().toString();
    InputStream raw = new BufferedInputStream(Files.newInputStream(file));
    if (name.endsWith(".gz")) {
      return new GZIPInputStream(raw);
    }
    if (name.endsWith(".xml")) {
      return raw;
    }
    raw.close();
    throw new IOException("unsupported errata compression: " + file);
  }

  private static Document newDocument() throws IOException {
    return builder().newDocument();
  }

  private static DocumentBuilder builder() throws IOException {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      return factory.newDocumentBuilder();
    } catch (ParserConfigurationException ex) {
      throw new IOException("XML parser unavailable", ex);
    }
  }

  private static void write(Document document, Path output) throws IOException {
    try (OutputStream out = Files.newOutputStream(output)) {
      Transformer transformer = TransformerFactory.newInstance().newTransformer();
      transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
      transformer.setOutputProperty(OutputKeys.INDENT, "yes");
      transformer.transform(new DOMSource(document), new StreamResult(out));
    } catch (TransformerException ex) {
      throw new IOException("cannot write " + output, ex);
    }
  }
}
