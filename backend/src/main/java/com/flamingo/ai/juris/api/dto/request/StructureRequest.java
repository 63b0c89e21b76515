package com.flamingo.ai.juris.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for segmenting already extracted judgment text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructureRequest {

  @NotBlank(message = "Text is required")
  private String text;
}
