package com.flamingo.ai.juris.service.segmentation.model;

/** Canonical sections of a judicial decision. */
public enum SectionKind {
  /** Header identifying court, parties and docket. */
  INTRODUCTION,

  /** The court's legal reasoning. */
  CONSIDERATIONS,

  /** Binding orders issued by the court. */
  RESOLUTION
}
