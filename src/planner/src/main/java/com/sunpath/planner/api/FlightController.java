package com.sunpath.planner.api;

import com.sunpath.planner.model.FlightAnalysisResponse;
import com.sunpath.planner.model.SunExposureSample;
import com.sunpath.planner.model.Timeline;
import com.sunpath.planner.model.Waypoint;
import com.sunpath.planner.service.FlightPlanService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing flight route, timeline and cabin exposure endpoints.
 *
 * <p>Locations are passed as {@code lat,lon} pairs and instants as epoch or ISO-8601 values.
 */
@RestController
@RequestMapping("/api/flights")
public class FlightController {
  private final FlightPlanService flightPlanService;

  /**
   * Creates the controller.
   *
   * @param flightPlanService service resolving route, timeline and exposure queries
   */
  public FlightController(FlightPlanService flightPlanService) {
    this.flightPlanService = flightPlanService;
  }

  /**
   * Returns great-circle waypoints between two locations.
   *
   * @param from origin {@code lat,lon}
   * @param to destination {@code lat,lon}
   * @param points optional segment count
   * @return ordered waypoints
   */
  @GetMapping("/waypoints")
  public List<Waypoint> waypoints(
      @RequestParam(value = "from", required = false) String from,
      @RequestParam(value = "to", required = false) String to,
      @RequestParam(value = "points", required = false) String points) {
    return flightPlanService.waypoints(from, to, points);
  }

  /**
   * Returns the time-stamped flight timeline with solar data.
   *
   * @param from origin {@code lat,lon}
   * @param to destination {@code lat,lon}
   * @param departure optional departure instant
   * @param points optional segment count
   * @param speed optional cruise speed in km/h
   * @param altitude optional cruise altitude in feet
   * @return timeline payload
   */
  @GetMapping("/timeline")
  public Timeline timeline(
      @RequestParam(value = "from", required = false) String from,
      @RequestParam(value = "to", required = false) String to,
      @RequestParam(value = "departure", required = false) String departure,
      @RequestParam(value = "points", required = false) String points,
      @RequestParam(value = "speed", required = false) String speed,
      @RequestParam(value = "altitude", required = false) String altitude) {
    return flightPlanService.timeline(from, to, departure, points, speed, altitude);
  }

  /**
   * Returns the cabin sun-exposure analysis of a flight.
   *
   * @param from origin {@code lat,lon}
   * @param to destination {@code lat,lon}
   * @param departure optional departure instant
   * @param points optional segment count
   * @param speed optional cruise speed in km/h
   * @param altitude optional cruise altitude in feet
   * @return analysis payload
   */
  @GetMapping("/analysis")
  public FlightAnalysisResponse analysis(
      @RequestParam(value = "from", required = false) String from,
      @RequestParam(value = "to", required = false) String to,
      @RequestParam(value = "departure", required = false) String departure,
      @RequestParam(value = "points", required = false) String points,
      @RequestParam(value = "speed", required = false) String speed,
      @RequestParam(value = "altitude", required = false) String altitude) {
    return flightPlanService.analysis(from, to, departure, points, speed, altitude);
  }

  /**
   * Classifies cabin exposure for a single heading and solar position.
   *
   * @param heading aircraft heading in degrees
   * @param azimuth solar azimuth in degrees
   * @param altitude solar altitude in degrees
   * @return exposure payload
   */
  @GetMapping("/exposure")
  public SunExposureSample exposure(
      @RequestParam(value = "heading", required = false) String heading,
      @RequestParam(value = "azimuth", required = false) String azimuth,
      @RequestParam(value = "altitude", required = false) String altitude) {
    return flightPlanService.exposure(heading, azimuth, altitude);
  }
}
