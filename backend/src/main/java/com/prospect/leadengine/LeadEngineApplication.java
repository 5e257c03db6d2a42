package com.prospect.leadengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeadEngineApplication.class, args);
  }
}
