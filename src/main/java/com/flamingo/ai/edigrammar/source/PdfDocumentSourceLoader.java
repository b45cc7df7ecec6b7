package com.flamingo.ai.edigrammar.source;

import com.flamingo.ai.edigrammar.exception.SourceUnreadableException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;
import technology.tabula.RectangularTextContainer;
import technology.tabula.Table;
import technology.tabula.extractors.SpreadsheetExtractionAlgorithm;

/**
 * Loads a PDF into an {@link InMemoryDocumentSource}.
 *
 * <p>Uses Apache PDFBox for per-page plain text and tabula-java's ruling-based {@link
 * SpreadsheetExtractionAlgorithm} for per-page cell grids. Every page is materialized before the PDF
 * is closed, so parsing never touches the file.
 */
@Component
@Slf4j
public class PdfDocumentSourceLoader {

  /**
   * Loads the PDF at {@code path}.
   *
   * @throws SourceUnreadableException if the file cannot be read or is not a valid PDF
   */
  public DocumentSource load(Path path) {
    String name = path.getFileName().toString();
    try {
      return load(name, Files.readAllBytes(path));
    } catch (IOException e) {
      log.error("Cannot read {}: {}", path, e.getMessage());
      throw new SourceUnreadableException(name, "Failed to read " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Loads a PDF from a stream. The caller retains ownership of {@code inputStream}.
   *
   * @throws SourceUnreadableException if the stream is not a valid PDF
   */
  public DocumentSource load(String name, InputStream inputStream) {
    try {
      return load(name, inputStream.readAllBytes());
    } catch (IOException e) {
      log.error("Cannot read {}: {}", name, e.getMessage());
      throw new SourceUnreadableException(name, "Failed to read " + name + ": " + e.getMessage(), e);
    }
  }

  private DocumentSource load(String name, byte[] bytes) {
    try (PDDocument pdfDoc = PDDocument.load(bytes)) {
      List<SourcePage> pages = extractPages(pdfDoc);
      log.debug("Loaded {} pages from {}", pages.size(), name);
      return new InMemoryDocumentSource(name, pages);
    } catch (IOException e) {
      log.error("PDF parsing failed for {}: {}", name, e.getMessage());
      throw new SourceUnreadableException(name, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private List<SourcePage> extractPages(PDDocument pdfDoc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    ObjectExtractor objectExtractor = new ObjectExtractor(pdfDoc);
    SpreadsheetExtractionAlgorithm algorithm = new SpreadsheetExtractionAlgorithm();

    List<SourcePage> pages = new ArrayList<>();
    int pageCount = pdfDoc.getNumberOfPages();
    for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
      stripper.setStartPage(pageNumber);
      stripper.setEndPage(pageNumber);
      String text = stripper.getText(pdfDoc);

      Page page = objectExtractor.extract(pageNumber);
      List<List<List<String>>> tables = new ArrayList<>();
      for (Table table : algorithm.extract(page)) {
        tables.add(toGrid(table));
      }
      pages.add(new SourcePage(text, tables));
    }
    return pages;
  }

  @SuppressWarnings("rawtypes")
  private List<List<String>> toGrid(Table table) {
    List<List<String>> grid = new ArrayList<>();
    for (List<RectangularTextContainer> row : table.getRows()) {
      List<String> cells = new ArrayList<>(row.size());
      for (RectangularTextContainer cell : row) {
        // tabula separates lines inside a cell with '\r'
        cells.add(cell.getText().replace('\r', '\n'));
      }
      grid.add(cells);
    }
    return grid;
  }
}
