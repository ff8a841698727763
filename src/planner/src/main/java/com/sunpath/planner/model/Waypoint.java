package com.sunpath.planner.model;

/**
 * Point along a great-circle route.
 *
 * @param lat latitude in degrees
 * @param lon longitude in degrees, possibly unwrapped past +/-180
 * @param distanceKm cumulative distance from the origin
 * @param bearing forward bearing toward the next waypoint, [0,360)
 */
public record Waypoint(double lat, double lon, double distanceKm, double bearing) {}
