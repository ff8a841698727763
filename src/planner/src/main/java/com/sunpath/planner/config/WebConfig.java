package com.sunpath.planner.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration letting a browser front end call the read-only API.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final PlannerProperties properties;

  /**
   * Creates Web MVC config with typed planner properties.
   *
   * @param properties planner configuration holding the CORS allowlist
   */
  public WebConfig(PlannerProperties properties) {
    this.properties = properties;
  }

  /**
   * Registers API CORS mappings when an allowlist is configured.
   *
   * @param registry Spring CORS registry
   */
  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> origins = properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (origins.isEmpty()) {
      return;
    }

    registry
        .addMapping("/api/**")
        .allowedMethods("GET", "OPTIONS")
        .allowedOrigins(origins.toArray(String[]::new))
        .maxAge(600);
  }
}
