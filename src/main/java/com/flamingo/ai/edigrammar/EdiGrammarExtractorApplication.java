package com.flamingo.ai.edigrammar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the EDI grammar extraction service. */
@SpringBootApplication
public class EdiGrammarExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(EdiGrammarExtractorApplication.class, args);
  }
}
