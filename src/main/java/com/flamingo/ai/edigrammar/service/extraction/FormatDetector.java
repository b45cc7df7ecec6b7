package com.flamingo.ai.edigrammar.service.extraction;

import com.flamingo.ai.edigrammar.config.ExtractionProperties;
import com.flamingo.ai.edigrammar.source.DocumentSource;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Classifies a document as one of the known {@link PdfConvention}s from its leading pages.
 *
 * <p>Rules are checked page by page in priority order and the first match wins. When nothing
 * matches, {@link PdfConvention#FAURECIA} is returned; detection never fails.
 */
@Service
@Slf4j
public class FormatDetector {

  static final PdfConvention FALLBACK = PdfConvention.FAURECIA;

  private static final Pattern VDA_SEGMENT_HEADER =
      Pattern.compile("Segment:\\s+[A-Z]{3}\\s+Cons\\.\\s*No\\.:");
  private static final Pattern FAURECIA_HEADER_SINGLE_LINE =
      Pattern.compile("Segment:.*Pos\\.:\\s*\\d+.*Level:");
  private static final Pattern FAURECIA_HEADER_SPLIT =
      Pattern.compile("Segment:\\s+Pos\\.:\\s*\\d+\\s+Level:");
  private static final Pattern COMMON_MNEMONIC = Pattern.compile("\\b(UNH|BGM|DTM|NAD|LIN|MOA)\\b");

  private final int pageLimit;

  @Autowired
  public FormatDetector(ExtractionProperties properties) {
    this(properties.getDetection().getPageLimit());
  }

  public FormatDetector(int pageLimit) {
    this.pageLimit = pageLimit;
  }

  /**
   * Detects the convention of {@code source} from its first pages.
   *
   * @param source document to inspect
   * @return detected convention, never null
   */
  public PdfConvention detect(DocumentSource source) {
    int pages = Math.min(pageLimit, source.pageCount());
    for (int i = 0; i < pages; i++) {
      PdfConvention convention = classify(source.pageText(i));
      if (convention != null) {
        log.info("Detected {} convention on page {} of {}", convention.tag(), i + 1, source.name());
        return convention;
      }
    }
    log.warn(
        "No convention marker in the first {} pages of {}, defaulting to {}",
        pages,
        source.name(),
        FALLBACK.tag());
    return FALLBACK;
  }

  /** Classifies a single page; returns null when the page carries no marker. */
  PdfConvention classify(String text) {
    if (text == null || text.isEmpty()) {
      return null;
    }
    if (VDA_SEGMENT_HEADER.matcher(text).find()) {
      return PdfConvention.VDA4932;
    }
    if (FAURECIA_HEADER_SINGLE_LINE.matcher(text).find()
        || FAURECIA_HEADER_SPLIT.matcher(text).find()) {
      return PdfConvention.FAURECIA;
    }
    if (text.contains("Pos.:") && COMMON_MNEMONIC.matcher(text).find()) {
      return PdfConvention.FAURECIA;
    }
    return null;
  }
}
