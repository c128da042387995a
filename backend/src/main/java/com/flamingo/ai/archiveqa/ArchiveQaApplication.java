package com.flamingo.ai.archiveqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the archive question-answering backend. */
@SpringBootApplication
public class ArchiveQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArchiveQaApplication.class, args);
  }
}
