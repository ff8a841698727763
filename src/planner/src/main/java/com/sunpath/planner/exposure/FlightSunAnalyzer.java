package com.sunpath.planner.exposure;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.geo.GeoFormat;
import com.sunpath.planner.model.CabinSide;
import com.sunpath.planner.model.FlightSunAnalysis;
import com.sunpath.planner.model.SunEventType;
import com.sunpath.planner.model.Timeline;
import com.sunpath.planner.model.TimelinePoint;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rolls per-point cabin exposure up into whole-flight side totals and advice.
 */
public final class FlightSunAnalyzer {
  public static final double RED_EYE_SHARE = 0.8;
  public static final double TROPICAL_SHARE = 0.4;
  public static final double DOMINANCE_RATIO = 2.0;
  public static final double DOMINANT_DAYLIGHT_SHARE = 0.7;
  public static final double FULL_DAYTIME_PERCENT = 80.0;

  private FlightSunAnalyzer() {}

  /**
   * Analyzes cabin sun exposure over a whole timeline.
   *
   * <p>Every point stands for an equal slice {@code totalDuration / points}, so the four side
   * totals always add up to the flight duration.
   *
   * @param timeline flight timeline
   * @return side totals, overall advice and a per-side breakdown
   */
  public static FlightSunAnalysis analyze(Timeline timeline) {
    if (timeline == null || timeline.points().isEmpty()) {
      throw new InvalidInputException("timeline has no points");
    }

    double duration = timeline.totalDurationMinutes();
    double slice = duration / timeline.points().size();

    Map<CabinSide, Double> minutes = new EnumMap<>(CabinSide.class);
    for (CabinSide side : CabinSide.values()) {
      minutes.put(side, 0.0);
    }
    for (TimelinePoint point : timeline.points()) {
      CabinSide side = SunExposureClassifier
          .classify(point.heading(), point.sunAzimuth(), point.sunAltitude())
          .side();
      minutes.merge(side, slice, Double::sum);
    }

    double left = minutes.get(CabinSide.LEFT);
    double right = minutes.get(CabinSide.RIGHT);
    double overhead = minutes.get(CabinSide.OVERHEAD);
    double none = minutes.get(CabinSide.NONE);

    return new FlightSunAnalysis(
        left,
        right,
        overhead,
        none,
        recommend(timeline, left, right, overhead, none),
        List.of(
            line("Left side exposure", left, duration),
            line("Right side exposure", right, duration),
            line("Overhead sun", overhead, duration),
            line("No sun (night/ahead/behind)", none, duration)));
  }

  private static String recommend(
      Timeline timeline, double left, double right, double overhead, double none) {
    double duration = timeline.totalDurationMinutes();
    double daylight = left + right + overhead;
    double daylightPercent = duration > 0 ? daylight / duration * 100.0 : 0.0;

    if (none > duration * RED_EYE_SHARE) {
      return FlightAdvice.RED_EYE.render();
    }
    if (overhead > duration * TROPICAL_SHARE) {
      return FlightAdvice.TROPICAL.render();
    }
    if (left > right * DOMINANCE_RATIO) {
      return dominantSide(CabinSide.LEFT, left, daylight);
    }
    if (right > left * DOMINANCE_RATIO) {
      return dominantSide(CabinSide.RIGHT, right, daylight);
    }
    if (daylightPercent > FULL_DAYTIME_PERCENT) {
      return FlightAdvice.FULL_DAYTIME.render();
    }
    if (!timeline.sunEvents().isEmpty()) {
      return timeline.sunEvents().get(0).type() == SunEventType.SUNRISE
          ? FlightAdvice.INCLUDES_SUNRISE.render()
          : FlightAdvice.INCLUDES_SUNSET.render();
    }
    return FlightAdvice.BALANCED.render();
  }

  private static String dominantSide(CabinSide side, double sideMinutes, double daylight) {
    FlightAdvice advice = sideMinutes / daylight > DOMINANT_DAYLIGHT_SHARE
        ? FlightAdvice.DOMINANT_SIDE
        : FlightAdvice.BRIGHTER_SIDE;
    return advice.render(side);
  }

  private static String line(String label, double minutes, double duration) {
    double percent = duration > 0 ? minutes / duration * 100.0 : 0.0;
    return String.format(
        Locale.ROOT, "%s: %s (%.0f%%)", label, GeoFormat.formatDuration(minutes), percent);
  }
}
