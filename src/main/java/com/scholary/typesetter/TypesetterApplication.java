package com.scholary.typesetter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TypesetterApplication {

  public static void main(String[] args) {
    // Font metrics are read through AWT without a display.
    System.setProperty("java.awt.headless", "true");
    SpringApplication.run(TypesetterApplication.class, args);
  }
}
