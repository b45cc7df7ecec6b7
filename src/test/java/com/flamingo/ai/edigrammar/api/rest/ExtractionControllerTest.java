package com.flamingo.ai.edigrammar.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.edigrammar.domain.model.CompositeGroup;
import com.flamingo.ai.edigrammar.domain.model.DataElement;
import com.flamingo.ai.edigrammar.domain.model.Segment;
import com.flamingo.ai.edigrammar.exception.GlobalExceptionHandler;
import com.flamingo.ai.edigrammar.exception.SourceUnreadableException;
import com.flamingo.ai.edigrammar.export.GrammarJsonCodec;
import com.flamingo.ai.edigrammar.service.extraction.EdiGrammarExtractor;
import com.flamingo.ai.edigrammar.service.extraction.ExtractionResult;
import com.flamingo.ai.edigrammar.service.extraction.ExtractionStatistics;
import com.flamingo.ai.edigrammar.service.extraction.PdfConvention;
import com.flamingo.ai.edigrammar.source.DocumentSource;
import com.flamingo.ai.edigrammar.source.InMemoryDocumentSource;
import com.flamingo.ai.edigrammar.source.PdfDocumentSourceLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.InputStream;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExtractionController Tests")
class ExtractionControllerTest {

  private MockMvc mockMvc;

  @Mock private PdfDocumentSourceLoader sourceLoader;
  @Mock private EdiGrammarExtractor extractor;

  private final MockMultipartFile upload =
      new MockMultipartFile("file", "DELFOR.pdf", "application/pdf", new byte[] {1, 2, 3});
  private final DocumentSource source = new InMemoryDocumentSource("DELFOR.pdf", List.of());

  @BeforeEach
  void setUp() {
    ExtractionController controller =
        new ExtractionController(sourceLoader, extractor, new GrammarJsonCodec());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  private static ExtractionResult nadResult() {
    Segment nad = new Segment("NAD", "Name and address");
    nad.addElement(new DataElement("3035", "Party qualifier", "an..3", "SU", "SU = Supplier"));
    CompositeGroup c082 = new CompositeGroup("C082", "Party identification details");
    c082.addElement(new DataElement("3039", "Party identifier", "an..35", "", ""));
    nad.addElement(c082);
    return new ExtractionResult(
        "DELFOR.pdf",
        PdfConvention.FAURECIA,
        List.of(nad),
        new ExtractionStatistics(1, 1, 1, 1, 2, 1, 1));
  }

  @Test
  @DisplayName("Should return the extracted grammar")
  void shouldReturnGrammar() throws Exception {
    when(sourceLoader.load(eq("DELFOR.pdf"), any(InputStream.class))).thenReturn(source);
    when(extractor.extract(source)).thenReturn(nadResult());

    mockMvc
        .perform(multipart("/api/extractions").file(upload))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].segment").value("NAD"))
        .andExpect(jsonPath("$[0].elements[0].champ").value("3035"))
        .andExpect(jsonPath("$[0].elements[0].valeur").value("SU"))
        .andExpect(jsonPath("$[0].elements[1].groupe").value("C082"))
        .andExpect(jsonPath("$[0].elements[1].champs[0].champ").value("3039"));
  }

  @Test
  @DisplayName("Should return the extraction statistics")
  void shouldReturnStatistics() throws Exception {
    when(sourceLoader.load(eq("DELFOR.pdf"), any(InputStream.class))).thenReturn(source);
    when(extractor.extract(source)).thenReturn(nadResult());

    mockMvc
        .perform(multipart("/api/extractions/statistics").file(upload))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.convention").value("faurecia"))
        .andExpect(jsonPath("$.segments").value(1))
        .andExpect(jsonPath("$.groups").value(1))
        .andExpect(jsonPath("$.totalElements").value(2));
  }

  @Test
  @DisplayName("Should return 422 when no segment is found")
  void shouldRejectDocumentWithoutSegments() throws Exception {
    when(sourceLoader.load(eq("DELFOR.pdf"), any(InputStream.class))).thenReturn(source);
    when(extractor.extract(source))
        .thenReturn(
            new ExtractionResult(
                "DELFOR.pdf",
                PdfConvention.FAURECIA,
                List.of(),
                new ExtractionStatistics(0, 0, 0, 0, 0, 0, 0)));

    mockMvc
        .perform(multipart("/api/extractions").file(upload))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("EXTRACTION_001"))
        .andExpect(jsonPath("$.errorId").exists());
  }

  @Test
  @DisplayName("Should return 422 when the upload is not a readable PDF")
  void shouldRejectUnreadableUpload() throws Exception {
    when(sourceLoader.load(eq("DELFOR.pdf"), any(InputStream.class)))
        .thenThrow(new SourceUnreadableException("DELFOR.pdf", "Failed to parse PDF"));

    mockMvc
        .perform(multipart("/api/extractions").file(upload))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("SOURCE_001"))
        .andExpect(jsonPath("$.message").value("Failed to read document"));
    verifyNoInteractions(extractor);
  }

  @Test
  @DisplayName("Should return 400 when the file part is missing")
  void shouldRejectMissingFile() throws Exception {
    mockMvc
        .perform(multipart("/api/extractions"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }
}
