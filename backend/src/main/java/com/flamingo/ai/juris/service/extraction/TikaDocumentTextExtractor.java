package com.flamingo.ai.juris.service.extraction;

import com.flamingo.ai.juris.exception.ContentProcessingException;
import io.micrometer.core.annotation.Timed;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * {@link DocumentTextExtractor} for Office and plain-text judgments (DOCX, DOC, TXT, …).
 *
 * <p>Uses Apache Tika's {@link AutoDetectParser} with a {@link ToXMLContentHandler} to produce an
 * XHTML representation, then walks the DOM and emits the text of every block element ({@code
 * <p>}, {@code <h1>}–{@code <h6>}, {@code <li>}, {@code <pre>}) followed by a blank line, so the
 * segmentation engine sees the document's paragraph boundaries.
 */
@Service
@Slf4j
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

  private static final Set<String> BLOCK_ELEMENTS =
      Set.of("p", "h1", "h2", "h3", "h4", "h5", "h6", "li", "pre");

  private static final String PARAGRAPH_SEPARATOR = "\n\n";

  @Override
  @Timed(value = "judgment.extract", description = "Time to extract text from a document")
  public String extract(InputStream inputStream, String fileName) {
    try {
      byte[] xhtml = toXhtml(inputStream, fileName);
      String text = xhtmlToText(xhtml);
      log.debug("Tika extracted {} chars from '{}'", text.length(), fileName);
      return text;
    } catch (Exception e) {
      log.error("TikaDocumentTextExtractor failed for '{}': {}", fileName, e.getMessage());
      throw new ContentProcessingException(
          fileName, "Failed to extract text from " + fileName + ": " + e.getMessage(), e);
    }
  }

  @Override
  public String method() {
    return "tika";
  }

  // ---- private helpers ----

  private byte[] toXhtml(InputStream inputStream, String fileName) throws Exception {
    AutoDetectParser tikaParser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    if (fileName != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    }
    tikaParser.parse(inputStream, handler, metadata);
    return out.toByteArray();
  }

  String xhtmlToText(byte[] xhtmlBytes) throws Exception {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtmlBytes));
    dom.getDocumentElement().normalize();

    StringBuilder text = new StringBuilder();
    NodeList bodies = dom.getElementsByTagNameNS("*", "body");
    Element root = bodies.getLength() > 0 ? (Element) bodies.item(0) : dom.getDocumentElement();
    collectBlocks(root, text);
    return text.toString().trim();
  }

  private void collectBlocks(Element element, StringBuilder text) {
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() == Node.TEXT_NODE) {
        appendBlock(child.getTextContent(), text);
      } else if (child.getNodeType() == Node.ELEMENT_NODE) {
        Element childElement = (Element) child;
        if (BLOCK_ELEMENTS.contains(localName(childElement))) {
          appendBlock(childElement.getTextContent(), text);
        } else {
          collectBlocks(childElement, text);
        }
      }
    }
  }

  private void appendBlock(String content, StringBuilder text) {
    if (content == null || content.isBlank()) {
      return;
    }
    text.append(content.trim()).append(PARAGRAPH_SEPARATOR);
  }

  private String localName(Element element) {
    String name = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    return name.toLowerCase();
  }
}
