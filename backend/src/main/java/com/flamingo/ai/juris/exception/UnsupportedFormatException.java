package com.flamingo.ai.juris.exception;

/** Exception thrown when no extractor handles the uploaded file's format. */
public class UnsupportedFormatException extends ContentProcessingException {

  private final String format;

  public UnsupportedFormatException(String fileName, String format) {
    super(
        fileName,
        "Unsupported format: " + (format.isEmpty() ? "(none)" : format),
        "Unsupported document format");
    this.format = format;
  }

  public String getFormat() {
    return format;
  }
}
