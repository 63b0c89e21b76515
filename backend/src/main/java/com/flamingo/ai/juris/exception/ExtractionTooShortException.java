package com.flamingo.ai.juris.exception;

/**
 * Exception thrown when extraction succeeded but produced too little text to be a judgment.
 *
 * <p>Reported separately from a structural failure: the segmentation engine itself never fails.
 */
public class ExtractionTooShortException extends ContentProcessingException {

  private final int extractedLength;
  private final int minimumLength;

  public ExtractionTooShortException(String fileName, int extractedLength, int minimumLength) {
    super(
        fileName,
        String.format(
            "Extracted text too short (%d characters, minimum %d)", extractedLength, minimumLength),
        "Document contains too little text");
    this.extractedLength = extractedLength;
    this.minimumLength = minimumLength;
  }

  public int getExtractedLength() {
    return extractedLength;
  }

  public int getMinimumLength() {
    return minimumLength;
  }
}
