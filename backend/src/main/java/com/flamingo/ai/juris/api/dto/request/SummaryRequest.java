package com.flamingo.ai.juris.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for building an AI-ready digest of a judgment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryRequest {

  @NotBlank(message = "Text is required")
  private String text;

  /** Optional character budget. If null, the configured default is used. */
  @Min(value = 500, message = "maxChars must be at least 500")
  @Max(value = 100000, message = "maxChars must not exceed 100000")
  private Integer maxChars;
}
