package com.advisorscout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AdvisorScoutApplication {

  public static void main(String[] args) {
    SpringApplication.run(AdvisorScoutApplication.class, args);
  }
}
