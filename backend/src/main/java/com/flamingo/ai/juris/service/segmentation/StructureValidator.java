package com.flamingo.ai.juris.service.segmentation;

import com.flamingo.ai.juris.config.SegmentationConfig;
import com.flamingo.ai.juris.service.segmentation.model.DocumentStructure;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Checks whether a recovered structure looks legally complete. */
@Component
@RequiredArgsConstructor
public class StructureValidator {

  private final SegmentationConfig config;

  public boolean isLegallyComplete(DocumentStructure structure) {
    SegmentationConfig.Validation limits = config.getValidation();
    return structure.introduction().length() >= limits.getMinIntroduction()
        && structure.considerations().length() >= limits.getMinConsiderations()
        && structure.resolution().length() >= limits.getMinResolution();
  }

  /**
   * Describes why a structure is incomplete.
   *
   * @param structure the structure to check
   * @return a warning listing section lengths, or empty when the structure is complete
   */
  public Optional<String> incompletenessWarning(DocumentStructure structure) {
    if (isLegallyComplete(structure)) {
      return Optional.empty();
    }
    SegmentationConfig.Validation limits = config.getValidation();
    return Optional.of(
        String.format(
            "Incomplete structure: introduction %d/%d, considerations %d/%d,"
                + " resolution %d/%d chars",
            structure.introduction().length(),
            limits.getMinIntroduction(),
            structure.considerations().length(),
            limits.getMinConsiderations(),
            structure.resolution().length(),
            limits.getMinResolution()));
  }
}
