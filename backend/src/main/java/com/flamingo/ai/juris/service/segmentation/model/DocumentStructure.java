package com.flamingo.ai.juris.service.segmentation.model;

import java.util.List;

/**
 * Canonical structure recovered from a judgment.
 *
 * @param introduction header and preamble (court, parties, docket)
 * @param considerations the court's reasoning
 * @param resolution the operative part, verbatim to the end of the document when located
 * @param others doctrinal excerpts copied in addition to their canonical section
 */
public record DocumentStructure(
    String introduction, String considerations, String resolution, List<String> others) {

  public DocumentStructure {
    introduction = introduction == null ? "" : introduction;
    considerations = considerations == null ? "" : considerations;
    resolution = resolution == null ? "" : resolution;
    others = others == null ? List.of() : List.copyOf(others);
  }

  public static DocumentStructure empty() {
    return new DocumentStructure("", "", "", List.of());
  }
}
