package com.flamingo.ai.edigrammar.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.edigrammar.api.dto.response.ExtractionSummaryResponse;
import com.flamingo.ai.edigrammar.exception.NoSegmentsFoundException;
import com.flamingo.ai.edigrammar.exception.SourceUnreadableException;
import com.flamingo.ai.edigrammar.export.GrammarJsonCodec;
import com.flamingo.ai.edigrammar.service.extraction.EdiGrammarExtractor;
import com.flamingo.ai.edigrammar.service.extraction.ExtractionResult;
import com.flamingo.ai.edigrammar.source.DocumentSource;
import com.flamingo.ai.edigrammar.source.PdfDocumentSourceLoader;
import java.io.IOException;
import java.io.InputStream;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for on-demand grammar extraction of an uploaded guideline PDF. */
@RestController
@RequestMapping("/api/extractions")
@RequiredArgsConstructor
public class ExtractionController {

  private static final String DEFAULT_NAME = "upload.pdf";

  private final PdfDocumentSourceLoader sourceLoader;
  private final EdiGrammarExtractor extractor;
  private final GrammarJsonCodec codec;

  /** Extracts the uploaded PDF and returns its segments in export layout. */
  @PostMapping(
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<JsonNode> extract(@RequestParam("file") MultipartFile file) {
    ExtractionResult result = extractDocument(file);
    return ResponseEntity.ok(codec.toTree(result.segments()));
  }

  /** Extracts the uploaded PDF and returns only the detected convention and counts. */
  @PostMapping(
      value = "/statistics",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ExtractionSummaryResponse> statistics(
      @RequestParam("file") MultipartFile file) {
    return ResponseEntity.ok(ExtractionSummaryResponse.fromResult(extractDocument(file)));
  }

  private ExtractionResult extractDocument(MultipartFile file) {
    String name = file.getOriginalFilename() == null ? DEFAULT_NAME : file.getOriginalFilename();
    DocumentSource source;
    try (InputStream inputStream = file.getInputStream()) {
      source = sourceLoader.load(name, inputStream);
    } catch (IOException e) {
      throw new SourceUnreadableException(name, "Failed to read upload: " + e.getMessage(), e);
    }
    ExtractionResult result = extractor.extract(source);
    if (result.isEmpty()) {
      throw new NoSegmentsFoundException(name);
    }
    return result;
  }
}
