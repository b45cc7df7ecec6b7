package com.flamingo.ai.edigrammar.export;

import com.flamingo.ai.edigrammar.config.ExtractionProperties;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Derives the JSON export path of a document: its base name without extension, with spaces and
 * hyphens replaced by underscores, under the output directory.
 */
@Component
public class OutputPathResolver {

  private final Path outputDir;

  @Autowired
  public OutputPathResolver(ExtractionProperties properties) {
    this(Path.of(properties.getOutputDir()));
  }

  public OutputPathResolver(Path outputDir) {
    this.outputDir = outputDir;
  }

  public Path resolve(String documentName) {
    return outputDir.resolve(exportName(documentName) + ".json");
  }

  static String exportName(String documentName) {
    String fileName = Path.of(documentName).getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    return stem.replace(' ', '_').replace('-', '_');
  }
}
