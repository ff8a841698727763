package com.sunpath.planner.model;

/**
 * Aggregate sun statistics of a flight timeline.
 *
 * @param daylightMinutes estimated minutes in daylight (point-count approximation)
 * @param darknessMinutes remaining minutes
 * @param daylightPercentage daylight share of the flight, [0,100]
 * @param averageSunAltitude mean solar altitude over all points
 * @param maxSunAltitude highest solar altitude
 * @param minSunAltitude lowest solar altitude
 */
public record TimelineStatistics(
    double daylightMinutes,
    double darknessMinutes,
    double daylightPercentage,
    double averageSunAltitude,
    double maxSunAltitude,
    double minSunAltitude) {}
