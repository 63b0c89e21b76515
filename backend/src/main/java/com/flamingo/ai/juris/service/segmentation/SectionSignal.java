package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.service.segmentation.model.SectionKind;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One row of the boundary-detection table: a section and the patterns that announce its start.
 *
 * <p>A paragraph matches the signal if any pattern is found in it. Patterns compiled without
 * {@link Pattern#MULTILINE} treat {@code ^} and {@code $} as the paragraph's own boundaries.
 *
 * @param kind section opened by this signal
 * @param name short label used in logs
 * @param keyword lower-case term every match must contain, checked before any pattern runs; {@code
 *     null} when the patterns share no such term
 * @param patterns alternatives, tried in order
 */
public record SectionSignal(
    SectionKind kind, String name, String keyword, List<Pattern> patterns) {

  public SectionSignal {
    patterns = List.copyOf(patterns);
  }

  public SectionSignal(SectionKind kind, String name, List<Pattern> patterns) {
    this(kind, name, null, patterns);
  }

  public boolean matches(String paragraph) {
    if (keyword != null && !paragraph.toLowerCase(Locale.ROOT).contains(keyword)) {
      return false;
    }
    for (Pattern pattern : patterns) {
      if (pattern.matcher(paragraph).find()) {
        return true;
      }
    }
    return false;
  }
}
