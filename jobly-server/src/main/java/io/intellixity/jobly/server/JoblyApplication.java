package io.intellixity.jobly.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class JoblyApplication {
  public static void main(String[] args) {
    SpringApplication.run(JoblyApplication.class, args);
  }
}
