package com.flamingo.ai.smartretrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmartRetrievalApplication {

  public static void main(String[] args) {
    SpringApplication.run(SmartRetrievalApplication.class, args);
  }
}
