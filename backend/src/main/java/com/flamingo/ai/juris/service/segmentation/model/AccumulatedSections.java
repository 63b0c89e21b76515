package com.flamingo.ai.juris.service.segmentation.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Snapshot of the boundary detector after a full pass over the filtered paragraphs.
 *
 * @param introductionParagraphs paragraphs assigned to the introduction, in document order
 * @param considerationsParagraphs paragraphs assigned to the considerations, in document order
 * @param resolution verbatim resolution text, trimmed; empty when not locked
 * @param others doctrinal excerpts in document order
 * @param locked sections whose start signal was found
 */
public record AccumulatedSections(
    List<Paragraph> introductionParagraphs,
    List<Paragraph> considerationsParagraphs,
    String resolution,
    List<String> others,
    Set<SectionKind> locked) {

  private static final String PARAGRAPH_SEPARATOR = "\n\n";

  public AccumulatedSections {
    introductionParagraphs = List.copyOf(introductionParagraphs);
    considerationsParagraphs = List.copyOf(considerationsParagraphs);
    resolution = resolution == null ? "" : resolution;
    others = List.copyOf(others);
    locked = Set.copyOf(locked);
  }

  public String introduction() {
    return join(introductionParagraphs);
  }

  public String considerations() {
    return join(considerationsParagraphs);
  }

  public boolean isLocked(SectionKind kind) {
    return locked.contains(kind);
  }

  public boolean nothingLocked() {
    return locked.isEmpty();
  }

  /**
   * Drops introduction and considerations content from {@code offset} onward. A paragraph that
   * straddles the offset keeps only its leading part.
   *
   * @param offset position in the normalized text
   * @return a copy whose introduction and considerations end before {@code offset}
   */
  public AccumulatedSections before(int offset) {
    return new AccumulatedSections(
        cut(introductionParagraphs, offset),
        cut(considerationsParagraphs, offset),
        resolution,
        others,
        locked);
  }

  public DocumentStructure toStructure() {
    return new DocumentStructure(introduction(), considerations(), resolution, others);
  }

  private static List<Paragraph> cut(List<Paragraph> paragraphs, int offset) {
    List<Paragraph> kept = new ArrayList<>(paragraphs.size());
    for (Paragraph paragraph : paragraphs) {
      int start = paragraph.sourceOffset();
      if (start + paragraph.length() <= offset) {
        kept.add(paragraph);
      } else if (start < offset) {
        String head = paragraph.text().substring(0, offset - start).trim();
        if (!head.isEmpty()) {
          kept.add(new Paragraph(paragraph.index(), head, paragraph.approximateOffset(), start));
        }
      }
    }
    return kept;
  }

  private static String join(List<Paragraph> paragraphs) {
    return paragraphs.stream()
        .map(Paragraph::text)
        .collect(Collectors.joining(PARAGRAPH_SEPARATOR));
  }
}
