package com.golfdata.clubtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClubTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClubTrackerApplication.class, args);
  }
}
