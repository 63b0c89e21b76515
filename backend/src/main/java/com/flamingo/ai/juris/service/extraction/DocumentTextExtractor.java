package com.flamingo.ai.juris.service.extraction;

import java.io.InputStream;

/**
 * Converts a binary judgment document into plain text with blank lines between paragraphs.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * requests. An extractor only extracts: it does not segment or summarize.
 */
public interface DocumentTextExtractor {

  /**
   * Extracts the document's text.
   *
   * <p>The caller retains ownership of {@code inputStream}; implementations must not close it.
   *
   * @param inputStream raw document bytes
   * @param fileName original file name, used as a format hint
   * @return extracted text, paragraphs separated by a blank line
   * @throws com.flamingo.ai.juris.exception.ContentProcessingException if the document cannot be
   *     read
   */
  String extract(InputStream inputStream, String fileName);

  /** Name recorded as the extraction method of the produced content. */
  String method();
}
