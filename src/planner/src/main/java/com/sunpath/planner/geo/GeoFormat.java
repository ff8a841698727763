package com.sunpath.planner.geo;

import java.util.Locale;

/**
 * Human-readable formatting of coordinates, distances and durations.
 */
public final class GeoFormat {
  private GeoFormat() {}

  /**
   * Formats a position as {@code 33.94°N, 118.41°W}.
   *
   * @param lat latitude in degrees
   * @param lon longitude in degrees, unwrapped values are folded back into [-180,180]
   * @return formatted coordinates
   */
  public static String formatCoordinates(double lat, double lon) {
    double canonicalLon = Angles.normalize180(lon);
    String latDir = lat >= 0 ? "N" : "S";
    String lonDir = canonicalLon >= 0 ? "E" : "W";
    return String.format(
        Locale.ROOT, "%.2f°%s, %.2f°%s", Math.abs(lat), latDir, Math.abs(canonicalLon), lonDir);
  }

  /**
   * Formats a distance with a unit that fits its magnitude.
   *
   * @param km distance in kilometers
   * @return {@code 850 m}, {@code 392.4 km} or {@code 4k km}
   */
  public static String formatDistance(double km) {
    if (km < 1) {
      return Math.round(km * 1000) + " m";
    }
    if (km < 1000) {
      return String.format(Locale.ROOT, "%.1f km", km);
    }
    return String.format(Locale.ROOT, "%.0fk km", km / 1000);
  }

  /**
   * Formats minutes as hours and whole minutes.
   *
   * @param minutes duration in minutes
   * @return for example {@code 5h 12m}
   */
  public static String formatDuration(double minutes) {
    long hours = (long) Math.floor(minutes / 60);
    long mins = (long) Math.floor(minutes % 60);
    return hours + "h " + mins + "m";
  }
}
