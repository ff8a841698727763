package com.sunpath.planner;

import com.sunpath.planner.config.PlannerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the SunPath planner API service.
 *
 * <p>The application exposes read-only endpoints over the solar ephemeris, daylight finder,
 * great-circle timeline builder and cabin sun-exposure classifier.
 */
@SpringBootApplication
@EnableConfigurationProperties(PlannerProperties.class)
public class PlannerApplication {
  /**
   * Starts the planner API application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(PlannerApplication.class, args);
  }
}
