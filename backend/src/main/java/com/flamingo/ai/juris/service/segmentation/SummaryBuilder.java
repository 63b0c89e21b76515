package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.service.segmentation.model.DocumentStructure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a budget-capped digest of a {@link DocumentStructure} for downstream AI analysis.
 *
 * <p>The budget {@code B} is shared as introduction {@code min(2000, 20% B)}, considerations
 * {@code min(4000, 50% B)} and resolution {@code min(2000, 25% B)}. Sections are truncated at a
 * sentence or line boundary when one lies in the last 20% of their window.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SummaryBuilder {

  static final String INTRODUCTION_HEADER = "=== INTRODUCCIÓN ===\n";
  static final String CONSIDERATIONS_HEADER = "=== CONSIDERACIONES ===\n";
  static final String RESOLUTION_HEADER = "=== RESUELVE ===\n";
  static final String ELLIPSIS = "...";

  private static final String SECTION_GAP = "\n\n";

  private final SegmentationConfig config;

  public String build(DocumentStructure structure) {
    return build(structure, config.getSummary().getDefaultBudget());
  }

  /**
   * Builds the digest.
   *
   * @param structure sections to summarize
   * @param budget maximum digest length in characters
   * @return the labelled digest, empty when every section is empty
   * @throws IllegalArgumentException if {@code budget} is negative
   */
  public String build(DocumentStructure structure, int budget) {
    if (budget < 0) {
      throw new IllegalArgumentException("Summary budget must not be negative: " + budget);
    }
    int introductionBudget = Math.min(2000, (int) (budget * 0.2));
    int considerationsBudget = Math.min(4000, (int) (budget * 0.5));
    int resolutionBudget = Math.min(2000, (int) (budget * 0.25));

    StringBuilder digest = new StringBuilder();
    appendSection(digest, INTRODUCTION_HEADER, structure.introduction(), introductionBudget);
    appendSection(digest, CONSIDERATIONS_HEADER, structure.considerations(), considerationsBudget);
    appendSection(digest, RESOLUTION_HEADER, structure.resolution(), resolutionBudget);

    String summary = truncate(digest.toString(), budget);
    log.debug("Summary built: {}/{} chars", summary.length(), budget);
    return summary;
  }

  private void appendSection(StringBuilder digest, String header, String content, int budget) {
    if (content == null || content.isEmpty()) {
      return;
    }
    if (digest.length() > 0) {
      digest.append(SECTION_GAP);
    }
    digest.append(header).append(truncate(content, budget));
  }

  /**
   * Cuts {@code text} to at most {@code maxLength} characters, preferring the last period or
   * newline inside the window when it lies at or beyond 80% of it. Otherwise the window is
   * hard-cut and {@value #ELLIPSIS} appended.
   */
  public static String truncate(String text, int maxLength) {
    if (text.length() <= maxLength) {
      return text;
    }
    String window = text.substring(0, maxLength);
    int cutPoint = Math.max(window.lastIndexOf('.'), window.lastIndexOf('\n'));
    if (cutPoint >= maxLength * 0.8) {
      return window.substring(0, cutPoint + 1);
    }
    return window + ELLIPSIS;
  }
}
