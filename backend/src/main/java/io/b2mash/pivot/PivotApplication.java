package io.b2mash.pivot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PivotApplication {

  public static void main(String[] args) {
    SpringApplication.run(PivotApplication.class, args);
  }
}
