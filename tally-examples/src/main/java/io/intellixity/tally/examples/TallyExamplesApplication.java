package io.intellixity.tally.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class TallyExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(TallyExamplesApplication.class, args);
  }
}
