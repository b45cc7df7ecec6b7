package com.flamingo.ai.edigrammar.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for grammar extraction. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionProperties {

  /** Directory scanned for guideline PDFs by the batch runner. */
  private String inputDir = "schema";

  /** Directory the JSON exports are written to. */
  private String outputDir = "export";

  private Detection detection = new Detection();
  private Faurecia faurecia = new Faurecia();
  private Vda vda = new Vda();
  private Batch batch = new Batch();

  @Getter
  @Setter
  public static class Detection {
    /** Number of leading pages inspected when classifying a document. */
    private int pageLimit = 10;
  }

  @Getter
  @Setter
  public static class Faurecia {
    /** Tables with fewer rows are treated as layout noise. */
    private int minRows = 5;
  }

  @Getter
  @Setter
  public static class Vda {
    private int minRows = 3;
  }

  @Getter
  @Setter
  public static class Batch {
    /** Run the batch extraction once on application startup. */
    private boolean enabled = false;
  }
}
