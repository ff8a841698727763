package com.sunpath.planner.model;

/**
 * Apparent position of the Sun for one observer and instant.
 *
 * @param azimuth compass direction in degrees, [0,360), 0=north, 90=east
 * @param altitude refracted elevation above the horizon in degrees, [-90,90]
 * @param zenith zenith angle in degrees, always {@code 90 - altitude}
 * @param distance Earth-Sun distance in AU (fixed at 1.0)
 * @param rightAscension right ascension in hours, [0,24)
 * @param declination declination in degrees
 */
public record SolarPosition(
    double azimuth,
    double altitude,
    double zenith,
    double distance,
    double rightAscension,
    double declination) {}
