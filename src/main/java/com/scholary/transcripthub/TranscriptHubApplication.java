package com.scholary.transcripthub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TranscriptHubApplication {

  public static void main(String[] args) {
    SpringApplication.run(TranscriptHubApplication.class, args);
  }
}
