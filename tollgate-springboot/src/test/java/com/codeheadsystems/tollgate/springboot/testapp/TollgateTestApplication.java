package com.codeheadsystems.tollgate.springboot.testapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Minimal application relying on auto-configuration only.
 */
@SpringBootApplication
public class TollgateTestApplication {

  public static void main(String[] args) {
    SpringApplication.run(TollgateTestApplication.class, args);
  }
}
