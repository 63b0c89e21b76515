package com.flamingo.ai.juris.service.content;

import com.flamingo.ai.juris.service.segmentation.model.DocumentStructure;
import com.flamingo.ai.juris.service.segmentation.model.ExtractionMetadata;

/**
 * Text and structure extracted from an uploaded judgment.
 *
 * @param fullText complete extracted text
 * @param wordCount number of whitespace-separated words
 * @param extractionMethod extractor that produced the text (e.g. {@code tika})
 * @param structure recovered sections
 * @param metadata structural quality and warnings
 */
public record ExtractedContent(
    String fullText,
    int wordCount,
    String extractionMethod,
    DocumentStructure structure,
    ExtractionMetadata metadata) {}
