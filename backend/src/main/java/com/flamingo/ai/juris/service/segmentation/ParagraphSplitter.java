package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.service.segmentation.model.Paragraph;
import com.flamingo.ai.juris.service.segmentation.model.SectionKind;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits normalized judgment text into paragraphs and drops noise.
 *
 * <p>The noise threshold is position-sensitive: operative clauses ("PRIMERO.- Conceder...") are
 * often one short sentence each, so paragraphs near or after the first "resuelve" only need {@code
 * filter.resolution-min-length} characters while everything else needs {@code filter.min-length}.
 * A paragraph that announces the resolution ("RESUELVE:" on its own) is never dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ParagraphSplitter {

  private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");

  /** Separator overhead counted per paragraph when estimating offsets. */
  private static final int SEPARATOR_LENGTH = 2;

  private final SegmentationConfig config;
  private final SectionSignalTable signalTable;

  /**
   * Splits and filters in one step.
   *
   * @param normalizedText output of {@link TextNormalizer}
   * @return retained paragraphs in document order
   */
  public List<Paragraph> paragraphs(String normalizedText) {
    return filter(split(normalizedText), ResolutionAnchor.locate(normalizedText));
  }

  /**
   * Splits on blank lines, trims and drops empty pieces.
   *
   * @param normalizedText output of {@link TextNormalizer}
   * @return every non-empty paragraph
   */
  public List<Paragraph> split(String normalizedText) {
    List<Paragraph> result = new ArrayList<>();
    if (normalizedText == null || normalizedText.isBlank()) {
      return result;
    }
    int[] approximateOffset = {0};
    int start = 0;
    Matcher separator = BLANK_LINE.matcher(normalizedText);
    while (separator.find()) {
      addPiece(normalizedText, start, separator.start(), result, approximateOffset);
      start = separator.end();
    }
    addPiece(normalizedText, start, normalizedText.length(), result, approximateOffset);
    return result;
  }

  private void addPiece(
      String text, int from, int to, List<Paragraph> result, int[] approximateOffset) {
    while (from < to && Character.isWhitespace(text.charAt(from))) {
      from++;
    }
    while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
      to--;
    }
    if (from == to) {
      return;
    }
    String piece = text.substring(from, to);
    result.add(new Paragraph(result.size(), piece, approximateOffset[0], from));
    approximateOffset[0] += piece.length() + SEPARATOR_LENGTH;
  }

  /**
   * Removes paragraphs below the applicable length threshold.
   *
   * @param paragraphs output of {@link #split}
   * @param resolutionAnchor offset of the first "resuelve", or a negative value when absent
   * @return retained paragraphs, original indexes and offsets preserved
   */
  public List<Paragraph> filter(List<Paragraph> paragraphs, int resolutionAnchor) {
    SegmentationConfig.Filter filter = config.getFilter();
    List<Paragraph> retained = new ArrayList<>(paragraphs.size());
    for (Paragraph paragraph : paragraphs) {
      int minLength =
          isNearResolution(paragraph, resolutionAnchor, filter.getResolutionWindow())
              ? filter.getResolutionMinLength()
              : filter.getMinLength();
      if (paragraph.length() >= minLength
          || signalTable.announces(SectionKind.RESOLUTION, paragraph.text())) {
        retained.add(paragraph);
      }
    }
    log.debug(
        "Paragraph filter kept {}/{} (resolution anchor at {})",
        retained.size(),
        paragraphs.size(),
        resolutionAnchor);
    return retained;
  }

  private boolean isNearResolution(Paragraph paragraph, int anchor, int window) {
    return anchor >= 0 && paragraph.approximateOffset() >= anchor - window;
  }
}
