package io.onschedule.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InspectionSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(InspectionSchedulerApplication.class, args);
  }
}
