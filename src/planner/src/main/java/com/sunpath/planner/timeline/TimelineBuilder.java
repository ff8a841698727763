package com.sunpath.planner.timeline;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.geo.GeoFormat;
import com.sunpath.planner.geo.GreatCircle;
import com.sunpath.planner.model.GeoPoint;
import com.sunpath.planner.model.SolarPosition;
import com.sunpath.planner.model.SunEvent;
import com.sunpath.planner.model.SunEventType;
import com.sunpath.planner.model.Timeline;
import com.sunpath.planner.model.TimelineOptions;
import com.sunpath.planner.model.TimelinePoint;
import com.sunpath.planner.model.TimelineStatistics;
import com.sunpath.planner.model.Waypoint;
import com.sunpath.planner.solar.DaylightCalculator;
import com.sunpath.planner.solar.SolarCalculator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Fuses a great-circle route with the solar ephemeris into a flight timeline.
 *
 * <p>The aircraft is assumed to fly the whole route at constant cruise speed, so waypoints are
 * evenly spaced in time as well as in distance.
 */
public final class TimelineBuilder {
  /** Above this many points the per-waypoint solar evaluation runs on the common pool. */
  static final int PARALLEL_THRESHOLD = 512;

  private TimelineBuilder() {}

  /**
   * Builds the timeline of a flight.
   *
   * @param origin departure point
   * @param destination arrival point
   * @param departure departure instant
   * @param options flight profile
   * @return timeline with {@code options.pointCount() + 1} points, events and statistics
   */
  public static Timeline build(
      GeoPoint origin, GeoPoint destination, Instant departure, TimelineOptions options) {
    if (departure == null) {
      throw new InvalidInputException("departure is required");
    }
    if (options == null) {
      throw new InvalidInputException("timeline options are required");
    }

    int segments = options.pointCount();
    List<Waypoint> waypoints = GreatCircle.waypoints(origin, destination, segments);
    double totalDistance = waypoints.get(waypoints.size() - 1).distanceKm();
    double totalDuration = totalDistance / options.cruiseSpeedKmh() * 60.0;

    IntStream indexes = IntStream.rangeClosed(0, segments);
    if (segments >= PARALLEL_THRESHOLD) {
      indexes = indexes.parallel();
    }
    List<TimelinePoint> points = indexes
        .mapToObj(i -> toPoint(waypoints.get(i), i, segments, departure, totalDuration, options))
        .toList();

    return new Timeline(
        origin,
        destination,
        departure,
        points,
        totalDistance,
        totalDuration,
        detectSunEvents(points),
        statistics(points, totalDuration));
  }

  /**
   * Finds day/night transitions between consecutive points.
   *
   * <p>Each event takes its time, position and index from the later point of the pair.
   *
   * @param points timeline points in order
   * @return sunrise and sunset events in order
   */
  public static List<SunEvent> detectSunEvents(List<TimelinePoint> points) {
    List<SunEvent> events = new ArrayList<>();
    for (int i = 1; i < points.size(); i++) {
      TimelinePoint previous = points.get(i - 1);
      TimelinePoint current = points.get(i);
      if (previous.daylight() == current.daylight()) {
        continue;
      }
      SunEventType type = current.daylight() ? SunEventType.SUNRISE : SunEventType.SUNSET;
      String label = type == SunEventType.SUNRISE ? "Sunrise" : "Sunset";
      events.add(new SunEvent(
          type,
          current.timestamp(),
          current.lat(),
          current.lon(),
          i,
          label + " at " + GeoFormat.formatCoordinates(current.lat(), current.lon())));
    }
    return List.copyOf(events);
  }

  /**
   * Aggregates daylight and solar altitude statistics.
   *
   * <p>Daylight minutes are the share of daylight points times the duration, not a time
   * integral; with evenly spaced points the two differ by at most one point slice.
   *
   * @param points timeline points
   * @param totalDuration flight duration in minutes
   * @return statistics summary
   */
  public static TimelineStatistics statistics(List<TimelinePoint> points, double totalDuration) {
    if (points.isEmpty()) {
      throw new InvalidInputException("timeline has no points");
    }

    long daylightPoints = points.stream().filter(TimelinePoint::daylight).count();
    double daylightShare = (double) daylightPoints / points.size();
    double daylightMinutes = daylightShare * totalDuration;
    double daylightPercentage = totalDuration > 0
        ? daylightMinutes / totalDuration * 100.0
        : daylightShare * 100.0;

    double sum = 0.0;
    double max = Double.NEGATIVE_INFINITY;
    double min = Double.POSITIVE_INFINITY;
    for (TimelinePoint point : points) {
      sum += point.sunAltitude();
      max = Math.max(max, point.sunAltitude());
      min = Math.min(min, point.sunAltitude());
    }

    return new TimelineStatistics(
        daylightMinutes,
        totalDuration - daylightMinutes,
        daylightPercentage,
        sum / points.size(),
        max,
        min);
  }

  private static TimelinePoint toPoint(
      Waypoint waypoint,
      int index,
      int segments,
      Instant departure,
      double totalDuration,
      TimelineOptions options) {
    double elapsedMinutes = totalDuration * index / segments;
    Instant timestamp = departure.plusNanos(Math.round(elapsedMinutes * 60_000_000_000.0));
    SolarPosition sun = SolarCalculator.position(waypoint.lat(), waypoint.lon(), timestamp);

    return new TimelinePoint(
        waypoint.lat(),
        waypoint.lon(),
        waypoint.distanceKm(),
        timestamp,
        elapsedMinutes,
        sun.azimuth(),
        sun.altitude(),
        sun.zenith(),
        sun.altitude() > DaylightCalculator.SUNRISE_SUNSET_ALTITUDE,
        waypoint.bearing(),
        options.cruiseSpeedKmh(),
        options.cruiseAltitudeFt());
  }
}
