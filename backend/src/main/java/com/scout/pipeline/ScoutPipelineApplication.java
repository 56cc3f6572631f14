package com.scout.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScoutPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ScoutPipelineApplication.class, args);
  }
}
