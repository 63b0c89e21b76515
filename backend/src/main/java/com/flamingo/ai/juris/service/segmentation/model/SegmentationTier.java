package com.flamingo.ai.juris.service.segmentation.model;

/** The detection path that produced the final {@link DocumentStructure}. */
public enum SegmentationTier {
  /** All located sections came from the paragraph signal table. */
  STRUCTURAL,

  /** Resolution was recovered by a raw-text search for the operative keyword. */
  RESOLUTION_TEXT_SEARCH,

  /** No signal anywhere; paragraphs were distributed 20/60/20 by position. */
  POSITIONAL,

  /** Segmentation failed unexpectedly; the raw text was split into word thirds. */
  WORD_SPLIT,

  /** Nothing to segment. */
  EMPTY_INPUT
}
