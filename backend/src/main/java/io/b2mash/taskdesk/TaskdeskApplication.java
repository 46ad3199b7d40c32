package io.b2mash.taskdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskdeskApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskdeskApplication.class, args);
  }
}
