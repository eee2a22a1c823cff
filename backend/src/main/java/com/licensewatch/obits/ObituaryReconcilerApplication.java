package com.licensewatch.obits;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ObituaryReconcilerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ObituaryReconcilerApplication.class, args);
  }
}
