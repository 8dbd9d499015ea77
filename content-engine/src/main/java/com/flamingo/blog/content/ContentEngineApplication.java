package com.flamingo.blog.content;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Wires the content path services for the site build. */
@SpringBootApplication
public class ContentEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContentEngineApplication.class, args);
  }
}
