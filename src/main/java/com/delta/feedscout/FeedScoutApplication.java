package com.delta.feedscout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FeedScoutApplication {

  public static void main(String[] args) {
    SpringApplication.run(FeedScoutApplication.class, args);
  }
}
