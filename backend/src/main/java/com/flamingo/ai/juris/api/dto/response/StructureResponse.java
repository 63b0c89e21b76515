package com.flamingo.ai.juris.api.dto.response;

import com.flamingo.ai.juris.service.segmentation.model.DocumentStructure;
import com.flamingo.ai.juris.service.segmentation.model.ExtractionMetadata;
import com.flamingo.ai.juris.service.segmentation.model.SegmentationResult;
import com.flamingo.ai.juris.service.segmentation.model.SegmentationTier;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a segmented judgment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructureResponse {

  private String introduction;
  private String considerations;
  private String resolution;
  private List<String> others;
  private boolean hasStructure;
  private SegmentationTier tier;
  private String language;
  private String encoding;
  private List<String> warnings;

  /** Creates a StructureResponse from a segmentation result. */
  public static StructureResponse fromResult(SegmentationResult result) {
    return from(result.structure(), result.metadata());
  }

  static StructureResponse from(DocumentStructure structure, ExtractionMetadata metadata) {
    return StructureResponse.builder()
        .introduction(structure.introduction())
        .considerations(structure.considerations())
        .resolution(structure.resolution())
        .others(structure.others())
        .hasStructure(metadata.hasStructure())
        .tier(metadata.tier())
        .language(metadata.language())
        .encoding(metadata.encoding())
        .warnings(metadata.warnings())
        .build();
  }
}
