package com.flamingo.ai.juris.service.content;

import com.flamingo.ai.juris.service.segmentation.model.SegmentationResult;
import java.util.List;

/**
 * Entry point for turning judgment documents into structure and AI-ready digests.
 *
 * <p>Callers only know this interface; the extractor and the segmentation engine behind it can be
 * swapped per format.
 */
public interface ContentProcessor {

  /** File extensions (lower case, with the dot) this processor accepts. */
  List<String> supportedFormats();

  /**
   * Returns {@code true} if the file's extension is supported.
   *
   * @param fileName original file name
   * @return {@code true} if supported
   */
  boolean canProcess(String fileName);

  /**
   * Extracts text from a binary document and segments it.
   *
   * @param content raw document bytes
   * @param fileName original file name
   * @return extracted content with structure and metadata
   * @throws com.flamingo.ai.juris.exception.UnsupportedFormatException if the extension is not
   *     supported
   * @throws com.flamingo.ai.juris.exception.ExtractionTooShortException if too little text was
   *     extracted
   * @throws com.flamingo.ai.juris.exception.ContentProcessingException if extraction fails
   */
  ExtractedContent extractText(byte[] content, String fileName);

  /**
   * Segments already extracted text.
   *
   * @param text judgment text
   * @return structure and metadata, never {@code null}
   */
  SegmentationResult extractStructure(String text);

  /**
   * Builds an AI-ready digest with the default budget.
   *
   * @param fullText judgment text
   * @return the digest
   */
  String generateSummary(String fullText);

  /**
   * Builds an AI-ready digest of at most roughly {@code maxChars} characters.
   *
   * @param fullText judgment text
   * @param maxChars character budget
   * @return the digest
   */
  String generateSummary(String fullText, int maxChars);
}
