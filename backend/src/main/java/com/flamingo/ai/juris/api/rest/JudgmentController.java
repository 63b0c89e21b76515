package com.flamingo.ai.juris.api.rest;

import com.flamingo.ai.juris.api.dto.request.StructureRequest;
import com.flamingo.ai.juris.api.dto.request.SummaryRequest;
import com.flamingo.ai.juris.api.dto.response.ExtractionResponse;
import com.flamingo.ai.juris.api.dto.response.StructureResponse;
import com.flamingo.ai.juris.api.dto.response.SummaryResponse;
import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.exception.ContentProcessingException;
import com.flamingo.ai.juris.service.content.ContentProcessor;
import com.flamingo.ai.juris.service.content.ExtractedContent;
import jakarta.validation.Valid;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for judgment segmentation. */
@RestController
@RequestMapping("/api/judgments")
@RequiredArgsConstructor
public class JudgmentController {

  private final ContentProcessor contentProcessor;
  private final SegmentationConfig config;

  /** Segments already extracted judgment text. */
  @PostMapping("/structure")
  public ResponseEntity<StructureResponse> extractStructure(
      @Valid @RequestBody StructureRequest request) {
    return ResponseEntity.ok(
        StructureResponse.fromResult(contentProcessor.extractStructure(request.getText())));
  }

  /** Builds a budget-capped digest for downstream AI analysis. */
  @PostMapping("/summary")
  public ResponseEntity<SummaryResponse> generateSummary(
      @Valid @RequestBody SummaryRequest request) {
    int maxChars =
        request.getMaxChars() != null
            ? request.getMaxChars()
            : config.getSummary().getDefaultBudget();
    String summary = contentProcessor.generateSummary(request.getText(), maxChars);
    return ResponseEntity.ok(
        SummaryResponse.builder()
            .summary(summary)
            .length(summary.length())
            .maxChars(maxChars)
            .build());
  }

  /** Extracts text from an uploaded judgment and segments it. */
  @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ExtractionResponse> extractDocument(
      @RequestParam("file") MultipartFile file) {
    String fileName = file.getOriginalFilename();
    byte[] bytes;
    try {
      bytes = file.getBytes();
    } catch (IOException e) {
      throw new ContentProcessingException(fileName, "Failed to read upload: " + e.getMessage(), e);
    }
    ExtractedContent content = contentProcessor.extractText(bytes, fileName);
    return ResponseEntity.ok(ExtractionResponse.fromContent(fileName, content));
  }
}
