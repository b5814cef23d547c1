package io.intellixity.fetchgraph.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class FetchgraphExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(FetchgraphExamplesApplication.class, args);
  }
}
