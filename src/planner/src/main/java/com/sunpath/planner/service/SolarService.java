package com.sunpath.planner.service;

import com.sunpath.planner.model.DaylightInfo;
import com.sunpath.planner.model.GeoPoint;
import com.sunpath.planner.model.SolarPosition;
import com.sunpath.planner.model.TwilightType;
import com.sunpath.planner.model.TwilightWindow;
import com.sunpath.planner.solar.DaylightCalculator;
import com.sunpath.planner.solar.SolarCalculator;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Query service for point solar lookups: position, daylight and twilight.
 */
@Service
public class SolarService {
  private static final Logger log = LoggerFactory.getLogger(SolarService.class);

  private final Clock clock;

  /**
   * Creates the solar query service.
   *
   * @param clock clock used for the default instant and date
   */
  public SolarService(Clock clock) {
    this.clock = clock;
  }

  /**
   * Computes the Sun's position for {@code GET /api/sun/position}.
   *
   * @param latRaw latitude query value
   * @param lonRaw longitude query value
   * @param atRaw optional instant (epoch or ISO-8601), defaults to now
   * @return solar position
   */
  public SolarPosition position(String latRaw, String lonRaw, String atRaw) {
    double lat = RequestParser.parseNumber(latRaw, "lat");
    double lon = RequestParser.parseNumber(lonRaw, "lon");
    Instant at = RequestParser.parseInstant(atRaw, clock.instant(), "at");
    GeoPoint.of(lat, lon);

    SolarPosition position = SolarCalculator.position(lat, lon, at);
    log.debug("Solar position lat={}, lon={}, at={}: altitude={}, azimuth={}",
        lat, lon, at, position.altitude(), position.azimuth());
    return position;
  }

  /**
   * Computes sunrise, sunset and twilight for {@code GET /api/sun/daylight}.
   *
   * @param latRaw latitude query value
   * @param lonRaw longitude query value
   * @param dateRaw optional {@code yyyy-MM-dd}, defaults to today (UTC)
   * @return daylight summary
   */
  public DaylightInfo daylight(String latRaw, String lonRaw, String dateRaw) {
    double lat = RequestParser.parseNumber(latRaw, "lat");
    double lon = RequestParser.parseNumber(lonRaw, "lon");
    LocalDate date = RequestParser.parseDate(dateRaw, LocalDate.now(clock));

    DaylightInfo info = DaylightCalculator.daylightInfo(lat, lon, date);
    if (info.alwaysDay() || info.alwaysNight()) {
      log.debug("Polar conditions at lat={}, lon={} on {}: alwaysDay={}, alwaysNight={}",
          lat, lon, date, info.alwaysDay(), info.alwaysNight());
    }
    return info;
  }

  /**
   * Computes dawn/dusk bounds for {@code GET /api/sun/twilight}.
   *
   * @param latRaw latitude query value
   * @param lonRaw longitude query value
   * @param dateRaw optional {@code yyyy-MM-dd}, defaults to today (UTC)
   * @param typeRaw optional twilight kind, defaults to civil
   * @return twilight window
   */
  public TwilightWindow twilight(String latRaw, String lonRaw, String dateRaw, String typeRaw) {
    double lat = RequestParser.parseNumber(latRaw, "lat");
    double lon = RequestParser.parseNumber(lonRaw, "lon");
    LocalDate date = RequestParser.parseDate(dateRaw, LocalDate.now(clock));
    TwilightType type = RequestParser.parseTwilightType(typeRaw);
    return DaylightCalculator.twilight(lat, lon, date, type);
  }
}
