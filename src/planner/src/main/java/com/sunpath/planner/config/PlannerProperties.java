package com.sunpath.planner.config;

import com.sunpath.planner.model.TimelineOptions;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the planner API service.
 *
 * <p>Values are bound from {@code planner.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {
  private final Timeline timeline = new Timeline();
  private final Api api = new Api();

  public Timeline getTimeline() {
    return timeline;
  }

  public Api getApi() {
    return api;
  }

  /** Flight profile defaults and the work cap applied to timeline requests. */
  public static class Timeline {
    private int defaultPointCount = TimelineOptions.DEFAULT_POINT_COUNT;
    private int maxPointCount = 2000;
    private double defaultCruiseSpeedKmh = TimelineOptions.DEFAULT_CRUISE_SPEED_KMH;
    private double defaultCruiseAltitudeFt = TimelineOptions.DEFAULT_CRUISE_ALTITUDE_FT;

    public int getDefaultPointCount() {
      return defaultPointCount;
    }

    public void setDefaultPointCount(int defaultPointCount) {
      this.defaultPointCount = defaultPointCount;
    }

    public int getMaxPointCount() {
      return maxPointCount;
    }

    public void setMaxPointCount(int maxPointCount) {
      this.maxPointCount = maxPointCount;
    }

    public double getDefaultCruiseSpeedKmh() {
      return defaultCruiseSpeedKmh;
    }

    public void setDefaultCruiseSpeedKmh(double defaultCruiseSpeedKmh) {
      this.defaultCruiseSpeedKmh = defaultCruiseSpeedKmh;
    }

    public double getDefaultCruiseAltitudeFt() {
      return defaultCruiseAltitudeFt;
    }

    public void setDefaultCruiseAltitudeFt(double defaultCruiseAltitudeFt) {
      this.defaultCruiseAltitudeFt = defaultCruiseAltitudeFt;
    }
  }

  /** API-level behavior configuration. */
  public static class Api {
    private final Cors cors = new Cors();

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist configuration for frontend consumers. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }
}
