package com.scholary.acquisition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AcquisitionApplication {

  public static void main(String[] args) {
    SpringApplication.run(AcquisitionApplication.class, args);
  }
}
