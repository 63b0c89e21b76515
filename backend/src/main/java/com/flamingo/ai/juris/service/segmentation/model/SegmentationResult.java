package com.flamingo.ai.juris.service.segmentation.model;

/**
 * Output of a single segmentation call.
 *
 * @param structure recovered sections
 * @param metadata quality flag, deciding tier and warnings
 */
public record SegmentationResult(DocumentStructure structure, ExtractionMetadata metadata) {}
