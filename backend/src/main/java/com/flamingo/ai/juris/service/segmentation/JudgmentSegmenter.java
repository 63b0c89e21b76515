package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.service.segmentation.model.AccumulatedSections;
import com.flamingo.ai.juris.service.segmentation.model.DocumentStructure;
import com.flamingo.ai.juris.service.segmentation.model.ExtractionMetadata;
import com.flamingo.ai.juris.service.segmentation.model.Paragraph;
import com.flamingo.ai.juris.service.segmentation.model.SegmentationResult;
import com.flamingo.ai.juris.service.segmentation.model.SegmentationTier;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Recovers the canonical structure of a judgment from its plain text.
 *
 * <p>Pipeline: {@link TextNormalizer} → {@link ParagraphSplitter} → {@link SectionAccumulator} →
 * {@link FallbackCascade} → {@link StructureValidator}. The call never fails for lack of
 * structure; problems are reported through {@link ExtractionMetadata#warnings()}. If the pipeline
 * itself throws, the raw text is split into three consecutive word-count thirds instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JudgmentSegmenter {

  private final TextNormalizer normalizer;
  private final ParagraphSplitter splitter;
  private final SectionAccumulator accumulator;
  private final FallbackCascade fallbackCascade;
  private final StructureValidator validator;
  private final SegmentationConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Segments a judgment.
   *
   * @param rawText extracted document text with any line-ending convention
   * @return structure and metadata; never {@code null}
   */
  @Timed(value = "judgment.segment", description = "Time to segment a judgment")
  public SegmentationResult segment(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      log.warn("Cannot segment judgment: empty content");
      return finish(
          DocumentStructure.empty(),
          SegmentationTier.EMPTY_INPUT,
          new ArrayList<>(List.of("Empty input")));
    }

    DocumentStructure structure;
    SegmentationTier tier;
    List<String> warnings = new ArrayList<>();
    try {
      String normalized = normalizer.normalize(rawText);
      List<Paragraph> paragraphs = splitter.paragraphs(normalized);
      AccumulatedSections accumulated = accumulator.accumulate(normalized, paragraphs);
      FallbackCascade.Outcome outcome =
          fallbackCascade.resolve(accumulated, normalized, paragraphs);
      structure = outcome.structure();
      tier = outcome.tier();
      warnings.addAll(outcome.warnings());
    } catch (RuntimeException e) {
      log.error("Structure extraction failed, splitting by word count: {}", e.getMessage(), e);
      structure = splitByWordCount(rawText);
      tier = SegmentationTier.WORD_SPLIT;
      warnings.add("Structure extraction failed; fell back to word-count split");
    }

    log.info(
        "Sections extracted via {} - Intro: {}ch, Considerations: {}ch, Resolution: {}ch",
        tier,
        structure.introduction().length(),
        structure.considerations().length(),
        structure.resolution().length());
    return finish(structure, tier, warnings);
  }

  private SegmentationResult finish(
      DocumentStructure structure, SegmentationTier tier, List<String> warnings) {
    boolean complete = validator.isLegallyComplete(structure);
    validator.incompletenessWarning(structure).ifPresent(warnings::add);
    meterRegistry
        .counter("judgment_segmentation_total", "tier", tier.name().toLowerCase(Locale.ROOT))
        .increment();
    return new SegmentationResult(structure, new ExtractionMetadata(complete, tier, warnings));
  }

  /** Last-resort split of the untouched input into three consecutive word-count thirds. */
  DocumentStructure splitByWordCount(String rawText) {
    List<String> words =
        Arrays.stream(rawText.trim().split("\\s+")).filter(w -> !w.isEmpty()).toList();
    int third = (words.size() + 2) / 3;
    int firstEnd = Math.min(third, words.size());
    int secondEnd = Math.min(2 * third, words.size());

    String introduction = String.join(" ", words.subList(0, firstEnd));
    String considerations = String.join(" ", words.subList(firstEnd, secondEnd));
    String resolution = String.join(" ", words.subList(secondEnd, words.size()));

    return new DocumentStructure(
        FallbackCascade.cut(introduction, config.getCaps().getIntroduction()),
        FallbackCascade.cut(considerations, config.getCaps().getConsiderations()),
        resolution,
        List.of());
  }
}
