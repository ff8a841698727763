package com.sunpath.planner.api;

import com.sunpath.planner.model.DaylightInfo;
import com.sunpath.planner.model.SolarPosition;
import com.sunpath.planner.model.TwilightWindow;
import com.sunpath.planner.service.SolarService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing point solar lookups.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/sun/position}: azimuth, altitude and equatorial coordinates</li>
 *   <li>{@code GET /api/sun/daylight}: sunrise, sunset, transit and civil twilight</li>
 *   <li>{@code GET /api/sun/twilight}: dawn/dusk bounds for one twilight kind</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/sun")
public class SolarController {
  private final SolarService solarService;

  /**
   * Creates the controller.
   *
   * @param solarService service resolving solar queries
   */
  public SolarController(SolarService solarService) {
    this.solarService = solarService;
  }

  /**
   * Returns the Sun's position for an observer.
   *
   * @param lat latitude in degrees
   * @param lon longitude in degrees
   * @param at optional instant (epoch or ISO-8601)
   * @return solar position payload
   */
  @GetMapping("/position")
  public SolarPosition position(
      @RequestParam(value = "lat", required = false) String lat,
      @RequestParam(value = "lon", required = false) String lon,
      @RequestParam(value = "at", required = false) String at) {
    return solarService.position(lat, lon, at);
  }

  /**
   * Returns daylight information for one UTC day.
   *
   * @param lat latitude in degrees
   * @param lon longitude in degrees
   * @param date optional {@code yyyy-MM-dd}
   * @return daylight payload
   */
  @GetMapping("/daylight")
  public DaylightInfo daylight(
      @RequestParam(value = "lat", required = false) String lat,
      @RequestParam(value = "lon", required = false) String lon,
      @RequestParam(value = "date", required = false) String date) {
    return solarService.daylight(lat, lon, date);
  }

  /**
   * Returns twilight bounds for one UTC day.
   *
   * @param lat latitude in degrees
   * @param lon longitude in degrees
   * @param date optional {@code yyyy-MM-dd}
   * @param type optional {@code civil|nautical|astronomical}
   * @return twilight payload
   */
  @GetMapping("/twilight")
  public TwilightWindow twilight(
      @RequestParam(value = "lat", required = false) String lat,
      @RequestParam(value = "lon", required = false) String lon,
      @RequestParam(value = "date", required = false) String date,
      @RequestParam(value = "type", required = false) String type) {
    return solarService.twilight(lat, lon, date, type);
  }
}
