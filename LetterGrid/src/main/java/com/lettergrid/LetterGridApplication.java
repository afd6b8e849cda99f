package com.lettergrid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LetterGridApplication {

  public static void main(String[] args) {
    SpringApplication.run(LetterGridApplication.class, args);
  }
}
