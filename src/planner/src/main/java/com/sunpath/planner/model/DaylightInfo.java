package com.sunpath.planner.model;

import java.time.Instant;

/**
 * Day/night summary for one location and calendar day.
 *
 * @param sunrise sunrise instant, {@code null} under polar day or night
 * @param sunset sunset instant, {@code null} under polar day or night
 * @param solarNoon instant of the Sun's upper transit
 * @param solarMidnight instant of the Sun's lower transit, twelve hours after noon
 * @param civilTwilightStart morning civil twilight start, {@code null} under polar conditions
 * @param civilTwilightEnd evening civil twilight end, {@code null} under polar conditions
 * @param dayLength hours of daylight
 * @param nightLength hours of darkness
 * @param alwaysDay midnight sun flag
 * @param alwaysNight polar night flag
 */
public record DaylightInfo(
    Instant sunrise,
    Instant sunset,
    Instant solarNoon,
    Instant solarMidnight,
    Instant civilTwilightStart,
    Instant civilTwilightEnd,
    double dayLength,
    double nightLength,
    boolean alwaysDay,
    boolean alwaysNight) {}
