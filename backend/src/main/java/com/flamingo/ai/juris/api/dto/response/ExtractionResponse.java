package com.flamingo.ai.juris.api.dto.response;

import com.flamingo.ai.juris.service.content.ExtractedContent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an uploaded judgment's extracted text and structure. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResponse {

  private String fileName;
  private String fullText;
  private int wordCount;
  private String extractionMethod;
  private StructureResponse structure;

  /** Creates an ExtractionResponse from extracted content. */
  public static ExtractionResponse fromContent(String fileName, ExtractedContent content) {
    return ExtractionResponse.builder()
        .fileName(fileName)
        .fullText(content.fullText())
        .wordCount(content.wordCount())
        .extractionMethod(content.extractionMethod())
        .structure(StructureResponse.from(content.structure(), content.metadata()))
        .build();
  }
}
