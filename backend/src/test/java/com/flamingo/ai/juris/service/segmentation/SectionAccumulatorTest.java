package com.flamingo.ai.juris.service.segmentation;

import static com.flamingo.ai.juris.service.segmentation.JudgmentFixtures.HEADER;
import static com.flamingo.ai.juris.service.segmentation.JudgmentFixtures.OPERATIVE;
import static com.flamingo.ai.juris.service.segmentation.JudgmentFixtures.REASONING;
import static com.flamingo.ai.juris.service.segmentation.JudgmentFixtures.filler;
import static com.flamingo.ai.juris.service.segmentation.JudgmentFixtures.paragraphs;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.service.segmentation.model.AccumulatedSections;
import com.flamingo.ai.juris.service.segmentation.model.SectionKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SectionAccumulator Tests")
class SectionAccumulatorTest {

  private ParagraphSplitter splitter;
  private SectionAccumulator accumulator;

  @BeforeEach
  void setUp() {
    SegmentationConfig config = new SegmentationConfig();
    splitter = new ParagraphSplitter(config, SectionSignalTable.judicialDefaults());
    accumulator = new SectionAccumulator(SectionSignalTable.judicialDefaults(), config);
  }

  private AccumulatedSections accumulate(String text) {
    return accumulator.accumulate(text, splitter.paragraphs(text));
  }

  private static String numbered(int number) {
    return "Párrafo " + number + " " + filler(290);
  }

  @Test
  @DisplayName("should assign a fully headed judgment to its three sections")
  void shouldAssignHeadedJudgment() {
    AccumulatedSections result = accumulate(JudgmentFixtures.fullJudgment());

    assertThat(result.locked())
        .containsExactlyInAnyOrder(
            SectionKind.INTRODUCTION, SectionKind.CONSIDERATIONS, SectionKind.RESOLUTION);
    assertThat(result.introduction())
        .isEqualTo(paragraphs(HEADER, JudgmentFixtures.PREAMBLE));
    assertThat(result.considerations())
        .startsWith("I. ANTECEDENTES")
        .contains(REASONING)
        .endsWith(JudgmentFixtures.CLOSING);
    assertThat(result.resolution()).isEqualTo(OPERATIVE);
  }

  @Nested
  @DisplayName("Soft caps")
  class SoftCaps {

    @Test
    @DisplayName("should stop feeding the introduction once it passes 2000 characters")
    void shouldCloseIntroduction_whenCapExceeded() {
      List<String> pieces = new ArrayList<>();
      pieces.add(HEADER);
      for (int i = 1; i <= 9; i++) {
        pieces.add(numbered(i));
      }

      AccumulatedSections result = accumulate(String.join("\n\n", pieces));

      assertThat(result.introduction()).contains("Párrafo 7 ").doesNotContain("Párrafo 8 ");
      assertThat(result.introduction().length()).isGreaterThan(2000);
      assertThat(result.considerations()).isEmpty();
    }

    @Test
    @DisplayName("should still lock considerations after the introduction is closed")
    void shouldLockConsiderations_whenIntroductionClosed() {
      List<String> pieces = new ArrayList<>();
      pieces.add(HEADER);
      for (int i = 1; i <= 9; i++) {
        pieces.add(numbered(i));
      }
      pieces.add(REASONING);
      pieces.add(filler(200));

      AccumulatedSections result = accumulate(String.join("\n\n", pieces));

      assertThat(result.isLocked(SectionKind.CONSIDERATIONS)).isTrue();
      assertThat(result.considerations()).startsWith("II. CONSIDERACIONES").endsWith(filler(200));
    }

    @Test
    @DisplayName("should never cap the resolution")
    void shouldNotCapResolution() {
      List<String> pieces = new ArrayList<>();
      pieces.add(OPERATIVE);
      for (int i = 1; i <= 20; i++) {
        pieces.add(numbered(i));
      }
      String tail = String.join("\n\n", pieces);

      AccumulatedSections result = accumulate(paragraphs(HEADER, REASONING, tail));

      assertThat(result.resolution()).isEqualTo(tail);
      assertThat(result.resolution().length()).isGreaterThan(6000);
    }
  }

  @Nested
  @DisplayName("Resolution")
  class Resolution {

    @Test
    @DisplayName("should keep short operative clauses that the noise filter would drop")
    void shouldKeepShortClauses() {
      String tail = paragraphs(OPERATIVE, "Cópiese.", "Cúmplase.");

      AccumulatedSections result = accumulate(paragraphs(HEADER, REASONING, tail));

      assertThat(result.resolution()).isEqualTo(tail);
    }

    @Test
    @DisplayName("should stop testing signals once the resolution is locked")
    void shouldIgnoreSignals_afterResolutionLocked() {
      String late = "Expediente T-999 remitido con los antecedentes para su archivo definitivo.";

      AccumulatedSections result = accumulate(paragraphs(HEADER, OPERATIVE, late));

      assertThat(result.introduction()).isEqualTo(HEADER);
      assertThat(result.isLocked(SectionKind.CONSIDERATIONS)).isFalse();
      assertThat(result.resolution()).endsWith(late);
    }
  }

  @Nested
  @DisplayName("Other bucket")
  class OtherBucket {

    @Test
    @DisplayName("should tag long doctrinal paragraphs only")
    void shouldTagLongDoctrinalParagraphs() {
      String longDoctrine = "La ratio decidendi de esta decisión es la siguiente: " + filler(150);
      String shortDoctrine = "La ratio decidendi se resume en el amparo de la salud del actor.";

      AccumulatedSections result =
          accumulate(paragraphs(HEADER, REASONING, longDoctrine, shortDoctrine));

      assertThat(result.others()).containsExactly(longDoctrine);
      assertThat(result.considerations()).contains(longDoctrine, shortDoctrine);
    }

    @Test
    @DisplayName("should keep tagging doctrinal paragraphs after the resolution starts")
    void shouldTagDoctrine_afterResolutionLocked() {
      String doctrine = "Se reitera la doctrina constitucional sobre la materia. " + filler(150);

      AccumulatedSections result = accumulate(paragraphs(HEADER, OPERATIVE, doctrine));

      assertThat(result.others()).containsExactly(doctrine);
    }
  }

  @Test
  @DisplayName("should lock nothing for text without vocabulary")
  void shouldLockNothing_whenNoVocabulary() {
    AccumulatedSections result = accumulate(paragraphs(filler(100), filler(120)));

    assertThat(result.nothingLocked()).isTrue();
    assertThat(result.introduction()).isEmpty();
    assertThat(result.considerations()).isEmpty();
    assertThat(result.resolution()).isEmpty();
  }
}
