package com.mk.fx.qa.loadgen.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadGeneratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(LoadGeneratorApplication.class, args);
  }
}
