package com.scholary.poster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PosterServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(PosterServiceApplication.class, args);
  }
}
