package com.flamingo.ai.juris.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for judgment segmentation and summarization. */
@Configuration
@ConfigurationProperties(prefix = "segmentation")
@Getter
@Setter
public class SegmentationConfig {

  private Filter filter = new Filter();
  private Caps caps = new Caps();
  private Other other = new Other();
  private Validation validation = new Validation();
  private Summary summary = new Summary();
  private Extraction extraction = new Extraction();

  /** Noise filter applied to paragraphs before boundary detection. */
  @Getter
  @Setter
  public static class Filter {
    private int minLength = 50;

    /** Minimum length for paragraphs close to (or after) the operative keyword. */
    private int resolutionMinLength = 10;

    /** Characters before the operative keyword where the lower threshold already applies. */
    private int resolutionWindow = 1000;
  }

  /** Soft caps closing generic accumulation. Resolution is never capped. */
  @Getter
  @Setter
  public static class Caps {
    private int introduction = 2000;
    private int considerations = 4000;
  }

  @Getter
  @Setter
  public static class Other {
    private int minLength = 150;
  }

  /** Minimum section lengths for a structure to count as legally complete. */
  @Getter
  @Setter
  public static class Validation {
    private int minIntroduction = 200;
    private int minConsiderations = 500;
    private int minResolution = 100;
  }

  @Getter
  @Setter
  public static class Summary {
    private int defaultBudget = 10_000;
  }

  /** Upstream binary-to-text extraction. */
  @Getter
  @Setter
  public static class Extraction {
    /** Extracted text shorter than this is rejected as too short. */
    private int minTextLength = 100;

    private List<String> supportedFormats = new ArrayList<>(List.of(".docx", ".doc", ".txt"));
  }
}
