package com.flamingo.ai.juris;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Judgment structure segmentation service. */
@SpringBootApplication
public class JurisApplication {

  public static void main(String[] args) {
    SpringApplication.run(JurisApplication.class, args);
  }
}
