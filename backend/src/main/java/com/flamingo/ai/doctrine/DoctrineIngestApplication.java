package com.flamingo.ai.doctrine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the doctrine ingestion service. */
@SpringBootApplication
public class DoctrineIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(DoctrineIngestApplication.class, args);
  }
}
