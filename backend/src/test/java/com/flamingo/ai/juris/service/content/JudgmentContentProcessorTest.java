package com.flamingo.ai.juris.service.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.exception.ExtractionTooShortException;
import com.flamingo.ai.juris.exception.UnsupportedFormatException;
import com.flamingo.ai.juris.service.extraction.DocumentTextExtractor;
import com.flamingo.ai.juris.service.segmentation.JudgmentFixtures;
import com.flamingo.ai.juris.service.segmentation.SummaryBuilder;
import com.flamingo.ai.juris.service.segmentation.model.SegmentationTier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("JudgmentContentProcessor Tests")
class JudgmentContentProcessorTest {

  @Mock private DocumentTextExtractor textExtractor;

  private JudgmentContentProcessor processor;

  @BeforeEach
  void setUp() {
    SegmentationConfig config = new SegmentationConfig();
    processor =
        new JudgmentContentProcessor(
            textExtractor,
            JudgmentFixtures.segmenter(config, new SimpleMeterRegistry()),
            new SummaryBuilder(config),
            config);
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Nested
  @DisplayName("Supported formats")
  class SupportedFormats {

    @Test
    @DisplayName("should accept Word and text files regardless of extension case")
    void shouldAcceptSupportedExtensions() {
      assertThat(processor.canProcess("T-123-24.docx")).isTrue();
      assertThat(processor.canProcess("fallo.DOC")).isTrue();
      assertThat(processor.canProcess("notas.txt")).isTrue();
    }

    @Test
    @DisplayName("should reject other extensions and missing names")
    void shouldRejectOtherExtensions() {
      assertThat(processor.canProcess("fallo.pdf")).isFalse();
      assertThat(processor.canProcess("sin_extension")).isFalse();
      assertThat(processor.canProcess(null)).isFalse();
    }

    @Test
    @DisplayName("should list configured formats")
    void shouldListConfiguredFormats() {
      assertThat(processor.supportedFormats()).containsExactly(".docx", ".doc", ".txt");
    }
  }

  @Nested
  @DisplayName("extractText")
  class ExtractText {

    @Test
    @DisplayName("should extract, segment and count words")
    void shouldExtractAndSegment() {
      String judgment = JudgmentFixtures.fullJudgment();
      when(textExtractor.extract(any(InputStream.class), eq("T-123-24.docx")))
          .thenReturn(judgment);
      when(textExtractor.method()).thenReturn("tika");

      ExtractedContent content = processor.extractText(bytes("binario"), "T-123-24.docx");

      assertThat(content.fullText()).isEqualTo(judgment);
      assertThat(content.extractionMethod()).isEqualTo("tika");
      assertThat(content.wordCount()).isEqualTo(judgment.trim().split("\\s+").length);
      assertThat(content.structure().resolution()).startsWith("RESUELVE:");
      assertThat(content.metadata().tier()).isEqualTo(SegmentationTier.STRUCTURAL);
    }

    @Test
    @DisplayName("should throw UnsupportedFormatException without calling the extractor")
    void shouldThrow_whenFormatUnsupported() {
      assertThatThrownBy(() -> processor.extractText(bytes("%PDF-1.7"), "fallo.pdf"))
          .isInstanceOf(UnsupportedFormatException.class)
          .satisfies(
              ex -> assertThat(((UnsupportedFormatException) ex).getFormat()).isEqualTo(".pdf"));

      verify(textExtractor, never()).extract(any(), any());
    }

    @Test
    @DisplayName("should throw ExtractionTooShortException below 100 characters")
    void shouldThrow_whenTextTooShort() {
      when(textExtractor.extract(any(InputStream.class), eq("vacio.docx")))
          .thenReturn("Sentencia sin contenido.");

      assertThatThrownBy(() -> processor.extractText(bytes("x"), "vacio.docx"))
          .isInstanceOf(ExtractionTooShortException.class)
          .satisfies(
              ex -> {
                ExtractionTooShortException tooShort = (ExtractionTooShortException) ex;
                assertThat(tooShort.getExtractedLength()).isEqualTo(24);
                assertThat(tooShort.getMinimumLength()).isEqualTo(100);
              });
    }
  }

  @Nested
  @DisplayName("Summaries")
  class Summaries {

    @Test
    @DisplayName("should build a labelled digest of a judgment")
    void shouldBuildDigest() {
      String summary = processor.generateSummary(JudgmentFixtures.fullJudgment());

      assertThat(summary)
          .startsWith("=== INTRODUCCIÓN ===\n")
          .contains("=== CONSIDERACIONES ===\n")
          .contains("=== RESUELVE ===\nRESUELVE:");
    }

    @Test
    @DisplayName("should respect an explicit budget")
    void shouldRespectBudget() {
      String summary = processor.generateSummary(JudgmentFixtures.fullJudgment(), 600);

      assertThat(summary.length()).isLessThanOrEqualTo(603);
    }
  }

  @Test
  @DisplayName("should count whitespace-separated words")
  void shouldCountWords() {
    assertThat(JudgmentContentProcessor.countWords("  PRIMERO.-\tConceder\n\nla  tutela "))
        .isEqualTo(4);
    assertThat(JudgmentContentProcessor.countWords("   ")).isZero();
    assertThat(JudgmentContentProcessor.countWords(null)).isZero();
  }
}
