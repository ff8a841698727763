package com.sunpath.planner.model;

import java.time.Instant;

/**
 * Sunrise or sunset crossed during a flight.
 *
 * @param type transition kind
 * @param timestamp instant of the first point on the new side of the transition
 * @param lat latitude of that point
 * @param lon longitude of that point
 * @param pointIndex index of that point in the timeline
 * @param description human-readable label
 */
public record SunEvent(
    SunEventType type,
    Instant timestamp,
    double lat,
    double lon,
    int pointIndex,
    String description) {}
