package com.flamingo.ai.juris.config;

import com.flamingo.ai.juris.service.segmentation.SectionSignalTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the segmentation engine's data-driven collaborators. */
@Configuration
public class SegmentationEngineConfig {

  /**
   * Signal table used by the boundary detector. Replace this bean to add court-specific
   * vocabulary.
   *
   * @return the default Colombian judgment signal table
   */
  @Bean
  public SectionSignalTable sectionSignalTable() {
    return SectionSignalTable.judicialDefaults();
  }
}
