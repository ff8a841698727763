package com.sunpath.planner.service;

import com.sunpath.planner.config.PlannerProperties;
import com.sunpath.planner.exposure.FlightSunAnalyzer;
import com.sunpath.planner.exposure.SunExposureClassifier;
import com.sunpath.planner.geo.GreatCircle;
import com.sunpath.planner.model.FlightAnalysisResponse;
import com.sunpath.planner.model.FlightSunAnalysis;
import com.sunpath.planner.model.GeoPoint;
import com.sunpath.planner.model.SunExposureSample;
import com.sunpath.planner.model.Timeline;
import com.sunpath.planner.model.TimelineOptions;
import com.sunpath.planner.model.Waypoint;
import com.sunpath.planner.timeline.TimelineBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Core query service for flight endpoints.
 *
 * <p>Parses raw request parameters, applies configured flight-profile defaults, caps the
 * requested point count and delegates to the route, timeline and exposure calculators.
 */
@Service
public class FlightPlanService {
  private static final Logger log = LoggerFactory.getLogger(FlightPlanService.class);
  private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT.withZone(ZoneOffset.UTC);

  private final PlannerProperties properties;
  private final Clock clock;
  private final Timer timelineBuildTimer;
  private final Counter clampedPointsCounter;

  /**
   * Creates the flight plan service.
   *
   * @param properties typed planner configuration
   * @param clock clock used for the default departure instant
   * @param meterRegistry registry for build timings
   */
  public FlightPlanService(PlannerProperties properties, Clock clock, MeterRegistry meterRegistry) {
    this.properties = properties;
    this.clock = clock;
    this.timelineBuildTimer = Timer.builder("planner.timeline.build.duration")
        .description("Time spent building flight timelines")
        .register(meterRegistry);
    this.clampedPointsCounter = Counter.builder("planner.timeline.points.clamped.total")
        .description("Requests whose point count exceeded the configured maximum")
        .register(meterRegistry);
  }

  /**
   * Generates great-circle waypoints for {@code GET /api/flights/waypoints}.
   *
   * @param fromRaw origin as {@code lat,lon}
   * @param toRaw destination as {@code lat,lon}
   * @param pointsRaw optional segment count
   * @return ordered waypoints, {@code points + 1} items
   */
  public List<Waypoint> waypoints(String fromRaw, String toRaw, String pointsRaw) {
    GeoPoint origin = RequestParser.parsePoint(fromRaw, "from");
    GeoPoint destination = RequestParser.parsePoint(toRaw, "to");
    int points = effectivePointCount(pointsRaw);
    return GreatCircle.waypoints(origin, destination, points);
  }

  /**
   * Builds the full timeline for {@code GET /api/flights/timeline}.
   *
   * @param fromRaw origin as {@code lat,lon}
   * @param toRaw destination as {@code lat,lon}
   * @param departureRaw optional departure instant, defaults to now
   * @param pointsRaw optional segment count
   * @param speedRaw optional cruise speed in km/h
   * @param altitudeRaw optional cruise altitude in feet
   * @return flight timeline
   */
  public Timeline timeline(
      String fromRaw,
      String toRaw,
      String departureRaw,
      String pointsRaw,
      String speedRaw,
      String altitudeRaw) {
    GeoPoint origin = RequestParser.parsePoint(fromRaw, "from");
    GeoPoint destination = RequestParser.parsePoint(toRaw, "to");
    Instant departure = RequestParser.parseInstant(departureRaw, clock.instant(), "departure");
    PlannerProperties.Timeline defaults = properties.getTimeline();
    TimelineOptions options = new TimelineOptions(
        effectivePointCount(pointsRaw),
        RequestParser.parseNumber(speedRaw, defaults.getDefaultCruiseSpeedKmh(), "speed"),
        RequestParser.parseNumber(altitudeRaw, defaults.getDefaultCruiseAltitudeFt(), "altitude"));

    Timeline timeline = timelineBuildTimer.record(
        () -> TimelineBuilder.build(origin, destination, departure, options));
    log.debug("Built timeline {} -> {} at {}: {} points, {} km, {} min, {} sun events",
        origin,
        destination,
        departure,
        timeline.points().size(),
        Math.round(timeline.totalDistanceKm()),
        Math.round(timeline.totalDurationMinutes()),
        timeline.sunEvents().size());
    return timeline;
  }

  /**
   * Builds the timeline and its cabin exposure rollup for {@code GET /api/flights/analysis}.
   *
   * @param fromRaw origin as {@code lat,lon}
   * @param toRaw destination as {@code lat,lon}
   * @param departureRaw optional departure instant, defaults to now
   * @param pointsRaw optional segment count
   * @param speedRaw optional cruise speed in km/h
   * @param altitudeRaw optional cruise altitude in feet
   * @return summary payload with statistics, sun events and side totals
   */
  public FlightAnalysisResponse analysis(
      String fromRaw,
      String toRaw,
      String departureRaw,
      String pointsRaw,
      String speedRaw,
      String altitudeRaw) {
    Timeline timeline = timeline(fromRaw, toRaw, departureRaw, pointsRaw, speedRaw, altitudeRaw);
    FlightSunAnalysis analysis = FlightSunAnalyzer.analyze(timeline);
    double initialHeading = timeline.points().get(0).heading();

    return new FlightAnalysisResponse(
        timeline.totalDistanceKm(),
        timeline.totalDurationMinutes(),
        initialHeading,
        GreatCircle.compassDirection(initialHeading),
        timeline.sunEvents(),
        timeline.statistics(),
        analysis,
        ISO.format(clock.instant()));
  }

  /**
   * Classifies instantaneous cabin exposure for {@code GET /api/flights/exposure}.
   *
   * @param headingRaw aircraft heading in degrees
   * @param azimuthRaw solar azimuth in degrees
   * @param altitudeRaw solar altitude in degrees
   * @return exposure sample
   */
  public SunExposureSample exposure(String headingRaw, String azimuthRaw, String altitudeRaw) {
    return SunExposureClassifier.classify(
        RequestParser.parseNumber(headingRaw, "heading"),
        RequestParser.parseNumber(azimuthRaw, "azimuth"),
        RequestParser.parseNumber(altitudeRaw, "altitude"));
  }

  private int effectivePointCount(String pointsRaw) {
    PlannerProperties.Timeline config = properties.getTimeline();
    int requested = RequestParser.parsePointCount(pointsRaw, config.getDefaultPointCount());
    int max = Math.max(1, config.getMaxPointCount());
    if (requested > max) {
      clampedPointsCounter.increment();
      log.debug("Clamping requested points {} to configured maximum {}", requested, max);
      return max;
    }
    return requested;
  }
}
