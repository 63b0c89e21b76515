package com.flamingo.ai.juris.service.segmentation;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Unifies line endings and collapses runs of blank lines into a single paragraph separator.
 *
 * <p>Case and accents are left untouched; matchers apply case-insensitivity themselves.
 */
@Component
public class TextNormalizer {

  private static final Pattern CRLF = Pattern.compile("\\r\\n?");
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n");

  public String normalize(String rawText) {
    if (rawText == null || rawText.isEmpty()) {
      return "";
    }
    String unified = CRLF.matcher(rawText).replaceAll("\n");
    return EXCESS_BLANK_LINES.matcher(unified).replaceAll("\n\n");
  }
}
