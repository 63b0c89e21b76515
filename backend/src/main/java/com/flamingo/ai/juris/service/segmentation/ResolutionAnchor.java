package com.flamingo.ai.juris.service.segmentation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Locates the first occurrence of the operative keyword "resuelve" in a text. */
final class ResolutionAnchor {

  static final int NOT_FOUND = -1;

  private static final Pattern KEYWORD =
      Pattern.compile("resuelve", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  private ResolutionAnchor() {}

  /**
   * Returns the character offset of the first case-insensitive "resuelve", or {@link #NOT_FOUND}.
   */
  static int locate(String text) {
    if (text == null || text.isEmpty()) {
      return NOT_FOUND;
    }
    Matcher matcher = KEYWORD.matcher(text);
    return matcher.find() ? matcher.start() : NOT_FOUND;
  }
}
