package com.sunpath.planner.model;

/**
 * Observer-independent equatorial coordinates of the Sun.
 *
 * @param rightAscension right ascension in hours, [0,24)
 * @param declination declination in degrees
 */
public record EquatorialCoordinates(double rightAscension, double declination) {}
