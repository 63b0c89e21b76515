package com.flamingo.ai.juris.exception;

/** Exception thrown when text cannot be extracted from an uploaded judgment. */
public class ContentProcessingException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public ContentProcessingException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = "Failed to extract text from document";
  }

  public ContentProcessingException(String fileName, String message, String userMessage) {
    super(message);
    this.fileName = fileName;
    this.userMessage = userMessage;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
