package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.config.SegmentationConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.StringJoiner;

/** Sample judgments and a fully wired engine for tests. */
public final class JudgmentFixtures {

  public static final String HEADER =
      "REPÚBLICA DE COLOMBIA\nCORTE CONSTITUCIONAL\nSala Novena de Revisión\n"
          + "Sentencia T-123 de 2024\nMagistrado Ponente: Juan Pérez";

  public static final String PREAMBLE =
      "Bogotá D.C., quince (15) de marzo de dos mil veinticuatro (2024). La Sala Novena de"
          + " Revisión, en ejercicio de sus competencias constitucionales y legales, profiere la"
          + " siguiente sentencia en el trámite de revisión del fallo de tutela dictado por el"
          + " Juzgado Tercero Civil Municipal de Bogotá.";

  public static final String BACKGROUND =
      "I. ANTECEDENTES\nLa accionante, de sesenta y siete años de edad, presentó acción de tutela"
          + " contra la entidad promotora de salud por negarle el suministro de un medicamento"
          + " prescrito por su médico tratante, alegando la vulneración de sus derechos a la salud"
          + " y a la vida digna.";

  public static final String FIRST_INSTANCE =
      "El juez de primera instancia negó el amparo por estimar que existía otro medio de defensa"
          + " judicial idóneo y que no se acreditó un perjuicio irremediable que justificara la"
          + " intervención del juez de tutela.";

  public static final String REASONING =
      "II. CONSIDERACIONES\nCorresponde a la Sala determinar si la entidad vulneró los derechos"
          + " fundamentales de la accionante al negar el medicamento, para lo cual reiterará la"
          + " jurisprudencia sobre el derecho fundamental a la salud y su protección reforzada para"
          + " personas de la tercera edad.";

  public static final String CLOSING =
      "En mérito de lo expuesto, la Sala Novena de Revisión de la Corte Constitucional,"
          + " administrando justicia en nombre del pueblo y por mandato de la Constitución,";

  public static final String OPERATIVE =
      "RESUELVE:\nPRIMERO.- Conceder la tutela.\nSEGUNDO.- Notificar.\n"
          + "TERCERO.- Por Secretaría General, líbrense las comunicaciones previstas en el"
          + " artículo 36 del Decreto 2591 de 1991.";

  public static final String INLINE_OPERATIVE =
      "Por lo anterior, la Sala resuelve conceder la tutela y ordenar a la entidad que entregue"
          + " el medicamento en cuarenta y ocho horas.\nNotifíquese y cúmplase.";

  private JudgmentFixtures() {}

  /** A judgment whose three sections are all announced by headings. */
  public static String fullJudgment() {
    return paragraphs(HEADER, PREAMBLE, BACKGROUND, FIRST_INSTANCE, REASONING, CLOSING, OPERATIVE);
  }

  /** A judgment whose operative part is not introduced by a heading. */
  public static String judgmentWithInlineOperativePart() {
    return paragraphs(
        HEADER, PREAMBLE, BACKGROUND, FIRST_INSTANCE, REASONING, CLOSING, INLINE_OPERATIVE);
  }

  /** Joins paragraphs with a single blank line. */
  public static String paragraphs(String... paragraphs) {
    StringJoiner joiner = new StringJoiner("\n\n");
    for (String paragraph : paragraphs) {
      joiner.add(paragraph);
    }
    return joiner.toString();
  }

  /** A neutral paragraph of exactly {@code length} characters without any section vocabulary. */
  public static String filler(int length) {
    StringBuilder text = new StringBuilder();
    while (text.length() < length) {
      text.append("texto de relleno sin marcas ");
    }
    return text.substring(0, length - 1) + ".";
  }

  public static JudgmentSegmenter segmenter(SegmentationConfig config, MeterRegistry registry) {
    return segmenter(
        config, registry, new SectionAccumulator(SectionSignalTable.judicialDefaults(), config));
  }

  public static JudgmentSegmenter segmenter(
      SegmentationConfig config, MeterRegistry registry, SectionAccumulator accumulator) {
    return new JudgmentSegmenter(
        new TextNormalizer(),
        new ParagraphSplitter(config, SectionSignalTable.judicialDefaults()),
        accumulator,
        new FallbackCascade(config),
        new StructureValidator(config),
        config,
        registry);
  }
}
