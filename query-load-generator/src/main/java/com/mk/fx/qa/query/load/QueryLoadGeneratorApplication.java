package com.mk.fx.qa.query.load;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryLoadGeneratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(QueryLoadGeneratorApplication.class, args);
  }
}
