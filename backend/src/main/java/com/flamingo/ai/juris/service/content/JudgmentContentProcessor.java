package com.flamingo.ai.juris.service.content;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.exception.ExtractionTooShortException;
import com.flamingo.ai.juris.exception.UnsupportedFormatException;
import com.flamingo.ai.juris.service.extraction.DocumentTextExtractor;
import com.flamingo.ai.juris.service.segmentation.JudgmentSegmenter;
import com.flamingo.ai.juris.service.segmentation.SummaryBuilder;
import com.flamingo.ai.juris.service.segmentation.model.SegmentationResult;
import io.micrometer.core.annotation.Timed;
import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link ContentProcessor} for judgments, backed by a {@link DocumentTextExtractor}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JudgmentContentProcessor implements ContentProcessor {

  private static final Pattern EXTENSION = Pattern.compile("\\.[^.]+$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final DocumentTextExtractor textExtractor;
  private final JudgmentSegmenter segmenter;
  private final SummaryBuilder summaryBuilder;
  private final SegmentationConfig config;

  @Override
  public List<String> supportedFormats() {
    return List.copyOf(config.getExtraction().getSupportedFormats());
  }

  @Override
  public boolean canProcess(String fileName) {
    return supportedFormats().contains(extensionOf(fileName));
  }

  @Override
  public ExtractedContent extractText(byte[] content, String fileName) {
    if (!canProcess(fileName)) {
      throw new UnsupportedFormatException(fileName, extensionOf(fileName));
    }

    log.info("Extracting text from '{}' ({} bytes)", fileName, content.length);
    String fullText = textExtractor.extract(new ByteArrayInputStream(content), fileName);

    int minLength = config.getExtraction().getMinTextLength();
    int length = fullText == null ? 0 : fullText.length();
    if (length < minLength) {
      log.warn("Extracted text from '{}' too short ({} chars)", fileName, length);
      throw new ExtractionTooShortException(fileName, length, minLength);
    }

    SegmentationResult result = segmenter.segment(fullText);
    int wordCount = countWords(fullText);
    log.info(
        "Extraction of '{}' complete - words: {}, structure: {}",
        fileName,
        wordCount,
        result.metadata().hasStructure());

    return new ExtractedContent(
        fullText, wordCount, textExtractor.method(), result.structure(), result.metadata());
  }

  @Override
  public SegmentationResult extractStructure(String text) {
    return segmenter.segment(text);
  }

  @Override
  @Timed(value = "judgment.summary", description = "Time to build a judgment digest")
  public String generateSummary(String fullText) {
    return generateSummary(fullText, config.getSummary().getDefaultBudget());
  }

  @Override
  @Timed(value = "judgment.summary", description = "Time to build a judgment digest")
  public String generateSummary(String fullText, int maxChars) {
    SegmentationResult result = segmenter.segment(fullText);
    String summary = summaryBuilder.build(result.structure(), maxChars);
    log.info("Summary generated: {}/{} chars", summary.length(), maxChars);
    return summary;
  }

  static int countWords(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return WHITESPACE.split(text.trim()).length;
  }

  private static String extensionOf(String fileName) {
    if (fileName == null) {
      return "";
    }
    Matcher matcher = EXTENSION.matcher(fileName);
    return matcher.find() ? matcher.group().toLowerCase(Locale.ROOT) : "";
  }
}
