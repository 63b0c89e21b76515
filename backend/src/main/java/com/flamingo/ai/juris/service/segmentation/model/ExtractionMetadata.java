package com.flamingo.ai.juris.service.segmentation.model;

import java.util.List;

/**
 * Quality information attached to a segmentation.
 *
 * @param hasStructure whether the recovered sections look legally complete
 * @param tier detection path that produced the structure
 * @param language document language
 * @param encoding text encoding
 * @param warnings human-readable notes about fallbacks and quality problems
 */
public record ExtractionMetadata(
    boolean hasStructure,
    SegmentationTier tier,
    String language,
    String encoding,
    List<String> warnings) {

  public static final String LANGUAGE = "es";
  public static final String ENCODING = "utf-8";

  public ExtractionMetadata {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public ExtractionMetadata(boolean hasStructure, SegmentationTier tier, List<String> warnings) {
    this(hasStructure, tier, LANGUAGE, ENCODING, warnings);
  }
}
