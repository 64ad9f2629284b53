package io.b2mash.opsdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OpsdeskApplication {

  public static void main(String[] args) {
    SpringApplication.run(OpsdeskApplication.class, args);
  }
}
