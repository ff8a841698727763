package com.sunpath.planner.model;

import java.time.Instant;
import java.util.List;

/**
 * Complete flight timeline.
 *
 * @param origin departure location
 * @param destination arrival location
 * @param departure departure instant
 * @param points ordered timeline points, index order is temporal order
 * @param totalDistanceKm great-circle distance
 * @param totalDurationMinutes flight duration at cruise speed
 * @param sunEvents sunrise/sunset transitions in order
 * @param statistics aggregate sun statistics
 */
public record Timeline(
    GeoPoint origin,
    GeoPoint destination,
    Instant departure,
    List<TimelinePoint> points,
    double totalDistanceKm,
    double totalDurationMinutes,
    List<SunEvent> sunEvents,
    TimelineStatistics statistics) {
  public Timeline {
    points = List.copyOf(points);
    sunEvents = List.copyOf(sunEvents);
  }
}
