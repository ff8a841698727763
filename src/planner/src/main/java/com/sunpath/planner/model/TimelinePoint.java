package com.sunpath.planner.model;

import java.time.Instant;

/**
 * Time-stamped waypoint enriched with solar data.
 *
 * @param lat latitude in degrees
 * @param lon longitude in degrees, possibly unwrapped
 * @param distanceKm cumulative distance from the origin
 * @param timestamp UTC instant the aircraft reaches the point
 * @param elapsedMinutes minutes since departure
 * @param sunAzimuth solar azimuth in degrees
 * @param sunAltitude solar altitude in degrees
 * @param sunZenith solar zenith angle in degrees
 * @param daylight whether the Sun is above the sunrise/sunset threshold
 * @param heading aircraft heading in degrees
 * @param speedKmh ground speed
 * @param altitudeFt cruise altitude
 */
public record TimelinePoint(
    double lat,
    double lon,
    double distanceKm,
    Instant timestamp,
    double elapsedMinutes,
    double sunAzimuth,
    double sunAltitude,
    double sunZenith,
    boolean daylight,
    double heading,
    double speedKmh,
    double altitudeFt) {}
