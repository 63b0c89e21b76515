package com.flamingo.ai.juris.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a judgment digest. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResponse {

  private String summary;
  private int length;
  private int maxChars;
}
