package com.flamingo.ai.juris.service.segmentation.model;

/**
 * A trimmed, non-empty block of normalized judgment text delimited by blank lines.
 *
 * @param index position among all non-empty paragraphs of the document
 * @param text trimmed paragraph text
 * @param approximateOffset sum of the lengths of all preceding paragraphs plus two separator
 *     characters each; an estimate used by the noise filter
 * @param sourceOffset exact offset of the first character of {@code text} in the normalized text
 */
public record Paragraph(int index, String text, int approximateOffset, int sourceOffset) {

  public int length() {
    return text.length();
  }
}
