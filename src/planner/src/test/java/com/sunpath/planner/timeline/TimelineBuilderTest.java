package com.sunpath.planner.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.model.GeoPoint;
import com.sunpath.planner.model.SunEvent;
import com.sunpath.planner.model.SunEventType;
import com.sunpath.planner.model.Timeline;
import com.sunpath.planner.model.TimelineOptions;
import com.sunpath.planner.model.TimelinePoint;
import com.sunpath.planner.model.TimelineStatistics;
import com.sunpath.planner.solar.DaylightCalculator;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimelineBuilderTest {
  private static final GeoPoint LAX = GeoPoint.of(33.9416, -118.4085);
  private static final GeoPoint JFK = GeoPoint.of(40.6413, -73.7781);
  private static final Instant RED_EYE_DEPARTURE = Instant.parse("2024-06-21T08:00:00Z");
  private static final Instant AFTERNOON_DEPARTURE = Instant.parse("2024-06-21T23:00:00Z");
  private static final TimelineOptions HUNDRED_POINTS = new TimelineOptions(100, 850.0, 37000.0);

  @Test
  void buildsOnePointPerSegmentBoundary() {
    Timeline timeline = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, HUNDRED_POINTS);

    assertEquals(101, timeline.points().size());
    assertThat(timeline.totalDistanceKm()).isBetween(3900.0, 4100.0);
    assertThat(timeline.totalDurationMinutes()).isBetween(250.0, 350.0);
    assertThat(timeline.totalDurationMinutes())
        .isCloseTo(timeline.totalDistanceKm() / 850.0 * 60.0, within(1e-9));
    assertEquals(LAX, timeline.origin());
    assertEquals(JFK, timeline.destination());
  }

  @Test
  void timestampsRunFromDepartureToArrival() {
    Timeline timeline = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, HUNDRED_POINTS);
    List<TimelinePoint> points = timeline.points();

    assertEquals(RED_EYE_DEPARTURE, points.get(0).timestamp());
    assertEquals(0.0, points.get(0).elapsedMinutes());
    assertThat(points.get(100).elapsedMinutes())
        .isCloseTo(timeline.totalDurationMinutes(), within(1e-9));
    long arrivalOffsetMs = Duration.between(RED_EYE_DEPARTURE, points.get(100).timestamp()).toMillis();
    assertThat(arrivalOffsetMs / 60_000.0).isCloseTo(timeline.totalDurationMinutes(), within(0.001));

    for (int i = 1; i < points.size(); i++) {
      assertThat(points.get(i).timestamp()).isAfter(points.get(i - 1).timestamp());
    }
  }

  @Test
  void daylightFlagFollowsSunriseThreshold() {
    Timeline timeline = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, HUNDRED_POINTS);

    for (TimelinePoint point : timeline.points()) {
      assertEquals(point.sunAltitude() > DaylightCalculator.SUNRISE_SUNSET_ALTITUDE, point.daylight());
      assertThat(point.sunZenith() + point.sunAltitude()).isCloseTo(90.0, within(1e-9));
    }
  }

  @Test
  void redEyeEastboundSeesSunrise() {
    Timeline timeline = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, HUNDRED_POINTS);

    assertThat(timeline.points().get(0).daylight()).isFalse();
    assertThat(timeline.points().get(100).daylight()).isTrue();
    assertThat(timeline.sunEvents()).extracting(SunEvent::type).contains(SunEventType.SUNRISE);
  }

  @Test
  void eveningEastboundSeesSunset() {
    Timeline timeline = TimelineBuilder.build(LAX, JFK, AFTERNOON_DEPARTURE, HUNDRED_POINTS);

    SunEvent sunset = timeline.sunEvents().stream()
        .filter(event -> event.type() == SunEventType.SUNSET)
        .findFirst()
        .orElseThrow();
    TimelinePoint at = timeline.points().get(sunset.pointIndex());

    assertThat(sunset.description()).startsWith("Sunset at ");
    assertEquals(at.timestamp(), sunset.timestamp());
    assertEquals(at.lat(), sunset.lat());
    assertNotEquals(
        timeline.points().get(sunset.pointIndex() - 1).daylight(),
        at.daylight());
  }

  @Test
  void statisticsAreConsistent() {
    Timeline timeline = TimelineBuilder.build(LAX, JFK, AFTERNOON_DEPARTURE, HUNDRED_POINTS);
    TimelineStatistics statistics = timeline.statistics();

    assertThat(statistics.daylightMinutes() + statistics.darknessMinutes())
        .isCloseTo(timeline.totalDurationMinutes(), within(1e-9));
    assertThat(statistics.daylightPercentage()).isBetween(0.0, 100.0);
    assertThat(statistics.averageSunAltitude())
        .isBetween(statistics.minSunAltitude(), statistics.maxSunAltitude());
  }

  @Test
  void flightProfileIsApplied() {
    Timeline cruise = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, HUNDRED_POINTS);
    Timeline slow = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, new TimelineOptions(100, 425.0, 30000.0));

    assertThat(slow.totalDurationMinutes())
        .isCloseTo(cruise.totalDurationMinutes() * 2, within(1e-9));
    assertTrue(slow.points().stream().allMatch(p -> p.altitudeFt() == 30000.0 && p.speedKmh() == 425.0));
  }

  @Test
  void coincidentEndpointsProduceZeroDurationTimeline() {
    GeoPoint paris = GeoPoint.of(48.85, 2.35);
    Timeline timeline = TimelineBuilder.build(paris, paris, Instant.parse("2024-06-21T12:00:00Z"), new TimelineOptions(4, 850.0, 37000.0));

    assertEquals(5, timeline.points().size());
    assertEquals(0.0, timeline.totalDistanceKm());
    assertEquals(0.0, timeline.totalDurationMinutes());
    assertTrue(timeline.points().stream().allMatch(p -> p.timestamp().equals(timeline.departure())));
    assertEquals(100.0, timeline.statistics().daylightPercentage());
    assertThat(timeline.sunEvents()).isEmpty();
  }

  @Test
  void largeTimelinesAreDeterministicAndOrdered() {
    TimelineOptions dense = new TimelineOptions(600, 850.0, 37000.0);
    Timeline first = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, dense);
    Timeline second = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, dense);

    assertEquals(601, first.points().size());
    assertEquals(first, second);
    for (int i = 1; i < first.points().size(); i++) {
      assertThat(first.points().get(i).distanceKm())
          .isGreaterThan(first.points().get(i - 1).distanceKm());
    }
  }

  @Test
  void fastestCruiseKeepsTimestampsStrictlyIncreasing() {
    TimelineOptions fastest = new TimelineOptions(2000, TimelineOptions.MAX_CRUISE_SPEED_KMH, 37000.0);
    GeoPoint start = GeoPoint.of(10.0, 10.0);
    GeoPoint end = GeoPoint.of(10.001, 10.0);

    for (Timeline timeline : List.of(
        TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, fastest),
        TimelineBuilder.build(start, end, RED_EYE_DEPARTURE, fastest))) {
      List<TimelinePoint> points = timeline.points();
      assertThat(timeline.totalDurationMinutes()).isPositive();
      for (int i = 1; i < points.size(); i++) {
        assertThat(points.get(i).timestamp()).isAfter(points.get(i - 1).timestamp());
      }
    }
  }

  @Test
  void slowestCruiseArrivesAtRepresentableInstant() {
    TimelineOptions slowest = new TimelineOptions(150, TimelineOptions.MIN_CRUISE_SPEED_KMH, 0.0);
    Timeline timeline = TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, slowest);
    Instant arrival = timeline.points().get(150).timestamp();

    assertThat(Duration.between(RED_EYE_DEPARTURE, arrival).toMinutes())
        .isCloseTo(Math.round(timeline.totalDurationMinutes()), within(1L));
    assertThat(arrival).isBefore(Instant.parse("2025-01-01T00:00:00Z"));
  }

  @Test
  void rejectsCruiseSpeedOutsideBounds() {
    assertThrows(InvalidInputException.class, () -> new TimelineOptions(10, 1e9, 37000.0));
    assertThrows(InvalidInputException.class, () -> new TimelineOptions(10, 1e-300, 37000.0));
    assertThrows(InvalidInputException.class, () -> new TimelineOptions(10, 5000.5, 37000.0));
  }

  @Test
  void endpointsWithinCoincidenceThresholdFormZeroLengthRoute() {
    GeoPoint start = GeoPoint.of(10.0, 10.0);
    GeoPoint end = GeoPoint.of(10.00001, 10.0);

    Timeline timeline = TimelineBuilder.build(start, end, RED_EYE_DEPARTURE, HUNDRED_POINTS);

    assertEquals(0.0, timeline.totalDistanceKm());
    assertEquals(0.0, timeline.totalDurationMinutes());
  }

  @Test
  void rejectsMissingDepartureOrOptions() {
    assertThrows(InvalidInputException.class, () -> TimelineBuilder.build(LAX, JFK, null, HUNDRED_POINTS));
    assertThrows(InvalidInputException.class, () -> TimelineBuilder.build(LAX, JFK, RED_EYE_DEPARTURE, null));
    assertThrows(InvalidInputException.class, () -> new TimelineOptions(0, 850.0, 37000.0));
    assertThrows(InvalidInputException.class, () -> new TimelineOptions(10, 0.0, 37000.0));
  }
}
