package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.service.segmentation.model.SectionKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ordered table of section signals evaluated in fixed priority, plus the doctrinal pattern used for
 * the supplementary "other" bucket.
 *
 * <p>Rows are tried top to bottom and the first row whose section is not yet locked and whose
 * patterns match wins. New vocabulary is added by building a table with extra rows; the detector's
 * control flow never changes.
 */
public final class SectionSignalTable {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private final List<SectionSignal> signals;
  private final Pattern doctrinePattern;

  public SectionSignalTable(List<SectionSignal> signals, Pattern doctrinePattern) {
    this.signals = List.copyOf(signals);
    this.doctrinePattern = doctrinePattern;
  }

  /** Vocabulary of Colombian constitutional and ordinary court decisions. */
  public static SectionSignalTable judicialDefaults() {
    List<SectionSignal> signals = new ArrayList<>();
    signals.add(
        new SectionSignal(
            SectionKind.INTRODUCTION,
            "case-header",
            List.of(
                compile(
                    "(?:en\\s+la\\s+ciudad\\s+de|la\\s+corte\\s+constitucional|sala\\s+plena"
                        + "|(?:magistrado|magistrada)\\s+ponente|expediente|radicación"
                        + "|demandante|demandado)"))));
    signals.add(
        new SectionSignal(
            SectionKind.CONSIDERATIONS,
            "reasoning-heading",
            List.of(
                compile(
                    "(?:antecedentes|i\\.\\s*antecedentes|1\\.\\s*antecedentes"
                        + "|hechos\\s+probados|síntesis\\s+de\\s+la\\s+demanda)"),
                compile(
                    "(?:consideraciones|considerandos|ii\\.\\s*consideraciones"
                        + "|2\\.\\s*consideraciones|fundamentos\\s+jurídicos"
                        + "|análisis\\s+constitucional|problema\\s+jurídico)"))));
    signals.add(
        new SectionSignal(
            SectionKind.RESOLUTION,
            "operative-heading",
            "resuelve",
            List.of(
                // heading on its own line, optionally numbered "III." or "3."
                Pattern.compile(
                    "(?:^|\\n)\\s*(?:(?:III|3)\\.?\\s*)?RESUELVE\\s*[:.]?\\s*(?:\\n|$)",
                    FLAGS | Pattern.MULTILINE),
                // the whole paragraph is the keyword
                compile("^\\s*RESUELVE\\s*[:.]?\\s*$"),
                // a line that ends with the keyword
                Pattern.compile("\\bRESUELVE\\s*[:.]?\\s*$", FLAGS | Pattern.MULTILINE),
                // "La Sala ... RESUELVE:" spread over several lines
                Pattern.compile(
                    "(?:corte|sala)[\\s\\S]*RESUELVE\\s*[:.]?\\s*$", FLAGS | Pattern.MULTILINE))));
    Pattern doctrine =
        compile(
            "(?:ratio\\s+decidendi|fundamento\\s+central|tesis\\s+principal"
                + "|doctrina\\s+constitucional)");
    return new SectionSignalTable(signals, doctrine);
  }

  /**
   * Finds the highest-priority signal matching the paragraph whose section is not locked yet.
   *
   * @param paragraph paragraph text
   * @param locked sections already opened
   * @return the winning signal, or empty
   */
  public Optional<SectionSignal> firstMatch(String paragraph, Set<SectionKind> locked) {
    for (SectionSignal signal : signals) {
      if (!locked.contains(signal.kind()) && signal.matches(paragraph)) {
        return Optional.of(signal);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns {@code true} if any row for {@code kind} matches the paragraph, regardless of locks.
   */
  public boolean announces(SectionKind kind, String paragraph) {
    for (SectionSignal signal : signals) {
      if (signal.kind() == kind && signal.matches(paragraph)) {
        return true;
      }
    }
    return false;
  }

  public boolean isDoctrinal(String paragraph) {
    return doctrinePattern.matcher(paragraph).find();
  }

  public List<SectionSignal> signals() {
    return signals;
  }

  private static Pattern compile(String regex) {
    return Pattern.compile(regex, FLAGS);
  }
}
