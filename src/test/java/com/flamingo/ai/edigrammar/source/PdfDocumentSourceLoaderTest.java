package com.flamingo.ai.edigrammar.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.edigrammar.exception.SourceUnreadableException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("PdfDocumentSourceLoader Tests")
class PdfDocumentSourceLoaderTest {

  private PdfDocumentSourceLoader loader;

  @BeforeEach
  void setUp() {
    loader = new PdfDocumentSourceLoader();
  }

  private static byte[] createPdf(String... pageLines) throws IOException {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      for (String line : pageLines) {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.beginText();
          content.setFont(PDType1Font.HELVETICA, 12);
          content.newLineAtOffset(72, 700);
          content.showText(line);
          content.endText();
        }
      }
      document.save(out);
      return out.toByteArray();
    }
  }

  @Test
  @DisplayName("should expose page text in page order")
  void shouldExtractPageText() throws Exception {
    byte[] pdf = createPdf("Segment: NAD Name and address", "Pos.: 0170 Segment: LIN");

    DocumentSource source = loader.load("DELFOR.pdf", new ByteArrayInputStream(pdf));

    assertThat(source.name()).isEqualTo("DELFOR.pdf");
    assertThat(source.pageCount()).isEqualTo(2);
    assertThat(source.pageText(0)).contains("Segment: NAD");
    assertThat(source.pageText(1)).contains("Pos.: 0170");
  }

  @Test
  @DisplayName("should report no tables on a page without ruling lines")
  void shouldReturnNoTablesWithoutRulings() throws Exception {
    DocumentSource source =
        loader.load("plain.pdf", new ByteArrayInputStream(createPdf("Introduction")));

    assertThat(source.pageTables(0)).isEmpty();
  }

  @Test
  @DisplayName("should load from a file and name the source after it")
  void shouldLoadFromPath(@TempDir Path tempDir) throws Exception {
    Path file = tempDir.resolve("VDA 4913.pdf");
    Files.write(file, createPdf("Segment: 711 Cons. No.: 01 Level: 1 Header"));

    DocumentSource source = loader.load(file);

    assertThat(source.name()).isEqualTo("VDA 4913.pdf");
    assertThat(source.pageText(0)).contains("Cons. No.: 01");
  }

  @Test
  @DisplayName("should reject content that is not a PDF")
  void shouldRejectInvalidPdf() {
    ByteArrayInputStream junk =
        new ByteArrayInputStream("not a pdf".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> loader.load("junk.pdf", junk))
        .isInstanceOf(SourceUnreadableException.class)
        .satisfies(
            e ->
                assertThat(((SourceUnreadableException) e).getDocumentName())
                    .isEqualTo("junk.pdf"));
  }

  @Test
  @DisplayName("should reject a missing file")
  void shouldRejectMissingFile(@TempDir Path tempDir) {
    assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.pdf")))
        .isInstanceOf(SourceUnreadableException.class)
        .hasMessageContaining("missing.pdf");
  }
}
