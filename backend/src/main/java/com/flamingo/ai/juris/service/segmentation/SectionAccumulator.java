package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.service.segmentation.model.AccumulatedSections;
import com.flamingo.ai.juris.service.segmentation.model.Paragraph;
import com.flamingo.ai.juris.service.segmentation.model.SectionKind;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Boundary detector: a single left-to-right pass assigning each filtered paragraph to at most one
 * canonical section.
 *
 * <p>For every paragraph, in order:
 *
 * <ol>
 *   <li>Once Resolution is locked nothing is tested any more: Resolution is the verbatim normalized
 *       text from the locking paragraph to the end of the document, short clauses included.
 *   <li>Otherwise the {@link SectionSignalTable} is consulted; a matching row locks its section,
 *       makes it the open section and receives the paragraph.
 *   <li>Without a match the paragraph falls through to the open section unless that section was
 *       closed by its soft cap.
 *   <li>Independently, long doctrinal paragraphs are copied to the "other" bucket.
 * </ol>
 *
 * <p>All state lives in a per-call {@link Pass}, so one instance serves concurrent documents.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SectionAccumulator {

  /** Separator overhead counted per paragraph against the soft caps. */
  private static final int SEPARATOR_LENGTH = 2;

  private final SectionSignalTable signalTable;
  private final SegmentationConfig config;

  /**
   * Runs the boundary detector over the filtered paragraphs.
   *
   * @param normalizedText the text the paragraphs were split from
   * @param paragraphs filtered paragraphs in document order
   * @return accumulated section texts and the set of locked sections
   */
  public AccumulatedSections accumulate(String normalizedText, List<Paragraph> paragraphs) {
    Pass pass = new Pass(normalizedText);
    for (Paragraph paragraph : paragraphs) {
      pass.accept(paragraph);
    }
    AccumulatedSections result = pass.freeze();
    log.debug(
        "Boundary detection over {} paragraphs locked {} (intro {}ch, considerations {}ch,"
            + " resolution {}ch, {} other)",
        paragraphs.size(),
        result.locked(),
        result.introduction().length(),
        result.considerations().length(),
        result.resolution().length(),
        result.others().size());
    return result;
  }

  /** Mutable state of one detection pass. */
  private final class Pass {

    private final Map<SectionKind, List<Paragraph>> members = new EnumMap<>(SectionKind.class);
    private final Map<SectionKind, Integer> accumulatedLength = new EnumMap<>(SectionKind.class);
    private final Set<SectionKind> locked = EnumSet.noneOf(SectionKind.class);
    private final Set<SectionKind> closed = EnumSet.noneOf(SectionKind.class);
    private final List<String> others = new ArrayList<>();
    private final String normalizedText;
    private SectionKind open;
    private int resolutionStart = -1;

    Pass(String normalizedText) {
      this.normalizedText = normalizedText;
      for (SectionKind kind : List.of(SectionKind.INTRODUCTION, SectionKind.CONSIDERATIONS)) {
        members.put(kind, new ArrayList<>());
        accumulatedLength.put(kind, 0);
      }
    }

    void accept(Paragraph paragraph) {
      String text = paragraph.text();
      tagOther(text);

      if (locked.contains(SectionKind.RESOLUTION)) {
        return;
      }

      Optional<SectionSignal> signal = signalTable.firstMatch(text, locked);
      if (signal.isPresent()) {
        SectionKind kind = signal.get().kind();
        log.debug(
            "Paragraph {} opens {} via '{}'", paragraph.index(), kind, signal.get().name());
        locked.add(kind);
        open = kind;
        if (kind == SectionKind.RESOLUTION) {
          resolutionStart = paragraph.sourceOffset();
        } else {
          append(kind, paragraph);
        }
        return;
      }

      if (open != null && !closed.contains(open)) {
        append(open, paragraph);
        closeIfOverCap(open);
      }
    }

    private void tagOther(String text) {
      if (text.length() > config.getOther().getMinLength() && signalTable.isDoctrinal(text)) {
        others.add(text);
      }
    }

    private void append(SectionKind kind, Paragraph paragraph) {
      members.get(kind).add(paragraph);
      accumulatedLength.merge(kind, paragraph.length() + SEPARATOR_LENGTH, Integer::sum);
    }

    private void closeIfOverCap(SectionKind kind) {
      int cap =
          kind == SectionKind.INTRODUCTION
              ? config.getCaps().getIntroduction()
              : config.getCaps().getConsiderations();
      if (accumulatedLength.get(kind) > cap) {
        log.debug("{} reached its {} character cap", kind, cap);
        closed.add(kind);
      }
    }

    AccumulatedSections freeze() {
      return new AccumulatedSections(
          members.get(SectionKind.INTRODUCTION),
          members.get(SectionKind.CONSIDERATIONS),
          resolutionStart >= 0 ? normalizedText.substring(resolutionStart).trim() : "",
          others,
          locked);
    }
  }
}
