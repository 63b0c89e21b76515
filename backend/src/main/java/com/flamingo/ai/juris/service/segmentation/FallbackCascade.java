package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.service.segmentation.model.AccumulatedSections;
import com.flamingo.ai.juris.service.segmentation.model.DocumentStructure;
import com.flamingo.ai.juris.service.segmentation.model.Paragraph;
import com.flamingo.ai.juris.service.segmentation.model.SectionKind;
import com.flamingo.ai.juris.service.segmentation.model.SegmentationTier;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides the final structure once the boundary detector (tier 1) has run.
 *
 * <ul>
 *   <li>Tier 2: Resolution never locked but the text contains "resuelve" somewhere. Resolution
 *       becomes the verbatim normalized text from that occurrence to the end, and introduction and
 *       considerations lose whatever they had accumulated from that offset onward.
 *   <li>Tier 3: no section located at all, even after tier 2. Accumulated content is discarded and
 *       the filtered paragraphs are distributed 20/60/20 by position.
 * </ul>
 *
 * <p>Exactly one tier determines each section of the returned structure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FallbackCascade {

  private static final String PARAGRAPH_SEPARATOR = "\n\n";

  private final SegmentationConfig config;

  /**
   * Result of the cascade.
   *
   * @param structure final sections
   * @param tier deepest tier that contributed
   * @param warnings notes describing the fallbacks taken
   */
  public record Outcome(DocumentStructure structure, SegmentationTier tier, List<String> warnings) {

    public Outcome {
      warnings = List.copyOf(warnings);
    }
  }

  /**
   * Applies tiers 2 and 3 as needed.
   *
   * @param accumulated tier 1 output
   * @param normalizedText normalized, unfiltered document text
   * @param filtered paragraphs that survived the noise filter
   * @return the final structure with the tier that decided it
   */
  public Outcome resolve(
      AccumulatedSections accumulated, String normalizedText, List<Paragraph> filtered) {
    List<String> warnings = new ArrayList<>();

    if (accumulated.isLocked(SectionKind.RESOLUTION)) {
      return new Outcome(accumulated.toStructure(), SegmentationTier.STRUCTURAL, warnings);
    }

    int anchor = ResolutionAnchor.locate(normalizedText);
    if (anchor != ResolutionAnchor.NOT_FOUND) {
      String resolution = normalizedText.substring(anchor).trim();
      log.info(
          "Resolution recovered by raw-text search at offset {}: {} chars",
          anchor,
          resolution.length());
      warnings.add("Resolution heading not detected; recovered by raw-text search for 'resuelve'");
      AccumulatedSections preceding = accumulated.before(anchor);
      DocumentStructure structure =
          new DocumentStructure(
              preceding.introduction(),
              preceding.considerations(),
              resolution,
              accumulated.others());
      return new Outcome(structure, SegmentationTier.RESOLUTION_TEXT_SEARCH, warnings);
    }

    if (accumulated.nothingLocked()) {
      log.warn(
          "No judicial structure detected, distributing {} paragraphs by position",
          filtered.size());
      warnings.add("No structural signal found; fell back to positional split");
      return new Outcome(positionalSplit(filtered), SegmentationTier.POSITIONAL, warnings);
    }

    warnings.add("Resolution not found");
    return new Outcome(accumulated.toStructure(), SegmentationTier.STRUCTURAL, warnings);
  }

  /**
   * Tier 3: first 20% of paragraphs to Introduction, up to 80% to Considerations, the rest to
   * Resolution. Boundaries are rounded up.
   */
  DocumentStructure positionalSplit(List<Paragraph> paragraphs) {
    int count = paragraphs.size();
    int introEnd = (count + 4) / 5;
    int considerationsEnd = (4 * count + 4) / 5;

    String introduction =
        cut(join(paragraphs.subList(0, introEnd)), config.getCaps().getIntroduction());
    String considerations =
        cut(
            join(paragraphs.subList(introEnd, considerationsEnd)),
            config.getCaps().getConsiderations());
    String resolution = join(paragraphs.subList(considerationsEnd, count));

    return new DocumentStructure(introduction.trim(), considerations.trim(), resolution, List.of());
  }

  private static String join(List<Paragraph> paragraphs) {
    return paragraphs.stream()
        .map(Paragraph::text)
        .collect(Collectors.joining(PARAGRAPH_SEPARATOR));
  }

  static String cut(String text, int maxChars) {
    return text.length() <= maxChars ? text : text.substring(0, maxChars);
  }
}
