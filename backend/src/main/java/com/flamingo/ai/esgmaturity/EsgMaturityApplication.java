package com.flamingo.ai.esgmaturity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the ESG maturity scoring service. */
@SpringBootApplication
public class EsgMaturityApplication {

  public static void main(String[] args) {
    SpringApplication.run(EsgMaturityApplication.class, args);
  }
}
