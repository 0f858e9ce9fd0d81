package com.mk.fx.qa.load.contention;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentionLoadApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContentionLoadApplication.class, args);
  }
}
