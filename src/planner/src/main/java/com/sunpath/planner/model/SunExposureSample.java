package com.sunpath.planner.model;

/**
 * Sun exposure of the cabin at one instant.
 *
 * @param side illuminated side
 * @param relativeBearing Sun bearing relative to the nose, (-180,180], positive to the right
 * @param sunAngle absolute relative bearing
 * @param intensity directness-weighted intensity, [0,1]
 * @param recommendation seat advice for this instant
 */
public record SunExposureSample(
    CabinSide side,
    double relativeBearing,
    double sunAngle,
    double intensity,
    String recommendation) {}
