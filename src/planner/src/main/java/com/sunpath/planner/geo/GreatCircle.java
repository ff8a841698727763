package com.sunpath.planner.geo;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.model.GeoPoint;
import com.sunpath.planner.model.Waypoint;
import java.util.ArrayList;
import java.util.List;

/**
 * Great-circle geometry on a spherical Earth.
 *
 * <p>Distances use the Haversine formula and intermediate points use spherical linear
 * interpolation, so waypoints are evenly spaced in angle along the route.
 */
public final class GreatCircle {
  public static final double EARTH_RADIUS_KM = 6371.0;

  /** Angular distances below this (radians) are treated as coincident points. */
  private static final double COINCIDENT_RAD = 0.00001;
  private static final String[] COMPASS = {"N", "NE", "E", "SE", "S", "SW", "W", "NW"};

  private GreatCircle() {}

  /**
   * Haversine distance between two points.
   *
   * @param from first point
   * @param to second point
   * @return distance in kilometers
   */
  public static double distanceKm(GeoPoint from, GeoPoint to) {
    double phi1 = Math.toRadians(from.lat());
    double phi2 = Math.toRadians(to.lat());
    double dPhi = Math.toRadians(to.lat() - from.lat());
    double dLambda = Math.toRadians(to.lon() - from.lon());

    double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
        + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_KM * c;
  }

  /**
   * Forward azimuth from one point toward another.
   *
   * @param from start point
   * @param to end point
   * @return bearing in degrees, [0,360), 0=north
   */
  public static double initialBearing(GeoPoint from, GeoPoint to) {
    double phi1 = Math.toRadians(from.lat());
    double phi2 = Math.toRadians(to.lat());
    double dLambda = Math.toRadians(to.lon() - from.lon());

    double y = Math.sin(dLambda) * Math.cos(phi2);
    double x = Math.cos(phi1) * Math.sin(phi2)
        - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLambda);
    return Angles.normalize360(Math.toDegrees(Math.atan2(y, x)));
  }

  /**
   * Point at a fraction of the great-circle arc between two points.
   *
   * @param from start point
   * @param to end point
   * @param fraction position along the arc, 0 = start, 1 = end
   * @return interpolated point with canonical longitude; the start point when both coincide
   */
  public static GeoPoint intermediatePoint(GeoPoint from, GeoPoint to, double fraction) {
    double delta = distanceKm(from, to) / EARTH_RADIUS_KM;
    if (delta < COINCIDENT_RAD) {
      return from;
    }

    double phi1 = Math.toRadians(from.lat());
    double lambda1 = Math.toRadians(from.lon());
    double phi2 = Math.toRadians(to.lat());
    double lambda2 = Math.toRadians(to.lon());

    double a = Math.sin((1 - fraction) * delta) / Math.sin(delta);
    double b = Math.sin(fraction * delta) / Math.sin(delta);

    double x = a * Math.cos(phi1) * Math.cos(lambda1) + b * Math.cos(phi2) * Math.cos(lambda2);
    double y = a * Math.cos(phi1) * Math.sin(lambda1) + b * Math.cos(phi2) * Math.sin(lambda2);
    double z = a * Math.sin(phi1) + b * Math.sin(phi2);

    double lat = Math.toDegrees(Math.atan2(z, Math.sqrt(x * x + y * y)));
    double lon = Math.toDegrees(Math.atan2(y, x));
    return new GeoPoint(lat, lon);
  }

  /**
   * Generates evenly spaced waypoints along the great circle, both endpoints included.
   *
   * <p>Longitudes are unwrapped across the antimeridian so consecutive points never jump by more
   * than 180 degrees; callers must not assume values stay within [-180,180]. Endpoints closer
   * than the coincidence threshold yield a zero-length route.
   *
   * @param origin departure point
   * @param destination arrival point
   * @param segments number of segments, the result has {@code segments + 1} waypoints
   * @return ordered waypoints with cumulative distance and forward bearing
   */
  public static List<Waypoint> waypoints(GeoPoint origin, GeoPoint destination, int segments) {
    if (origin == null || destination == null) {
      throw new InvalidInputException("origin and destination are required");
    }
    if (segments < 1) {
      throw new InvalidInputException("points must be >= 1");
    }

    double totalDistance = distanceKm(origin, destination);
    if (totalDistance / EARTH_RADIUS_KM < COINCIDENT_RAD) {
      totalDistance = 0.0;
    }
    List<GeoPoint> points = new ArrayList<>(segments + 1);
    for (int i = 0; i <= segments; i++) {
      points.add(intermediatePoint(origin, destination, (double) i / segments));
    }

    double[] longitudes = unwrapLongitudes(points.stream().mapToDouble(GeoPoint::lon).toArray());

    List<Waypoint> waypoints = new ArrayList<>(segments + 1);
    double bearing = 0.0;
    for (int i = 0; i <= segments; i++) {
      GeoPoint point = points.get(i);
      if (i < segments) {
        bearing = initialBearing(point, points.get(i + 1));
      }
      double fraction = (double) i / segments;
      waypoints.add(new Waypoint(point.lat(), longitudes[i], totalDistance * fraction, bearing));
    }
    return List.copyOf(waypoints);
  }

  /**
   * Removes +/-360 jumps between consecutive longitudes.
   *
   * @param longitudes canonical longitudes in route order
   * @return continuous longitudes, possibly outside [-180,180]
   */
  public static double[] unwrapLongitudes(double[] longitudes) {
    double[] unwrapped = longitudes.clone();
    for (int i = 1; i < unwrapped.length; i++) {
      double diff = unwrapped[i] - unwrapped[i - 1];
      while (diff > 180.0) {
        unwrapped[i] -= 360.0;
        diff -= 360.0;
      }
      while (diff < -180.0) {
        unwrapped[i] += 360.0;
        diff += 360.0;
      }
    }
    return unwrapped;
  }

  /**
   * Eight-point compass label for a bearing.
   *
   * @param bearing bearing in degrees
   * @return one of N, NE, E, SE, S, SW, W, NW
   */
  public static String compassDirection(double bearing) {
    int index = (int) (Math.round(Angles.normalize360(bearing) / 45.0) % 8);
    return COMPASS[index];
  }
}
