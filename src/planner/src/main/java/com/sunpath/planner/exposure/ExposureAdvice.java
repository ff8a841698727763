package com.sunpath.planner.exposure;

import com.sunpath.planner.model.CabinSide;
import java.util.Locale;

/**
 * Seat advice templates for a single instant, keyed by classifier branch.
 *
 * <p>Templates take the lit side as {@code %1$s} and the opposite side as {@code %2$s}.
 */
enum ExposureAdvice {
  NIGHT("Nighttime flight - ideal for rest or stargazing from either side"),
  TWILIGHT_SUNRISE("Sunrise approaching on %1$s side - perfect for golden hour photography!"),
  TWILIGHT_SUNSET("Sunset colors visible on %1$s side - grab your camera!"),
  OVERHEAD("Tropical route - sun overhead, both sides have similar lighting for cloud photography"),
  AHEAD_LOW("Low sun ahead - beautiful atmospheric views from either side"),
  AHEAD("Sun ahead - balanced lighting on both sides"),
  BEHIND("Sun behind - great lighting for forward views, either side works well"),
  INTENSE("Intense sun on %1$s - choose %2$s side if you need to rest or work on screen"),
  GOLDEN_HOUR("%1$s side has beautiful low-angle sunlight - great for aerial photography!"),
  GOOD_LIGHT("%1$s side has good natural light - ideal for sightseeing and photos"),
  GENTLE("Gentle sunlight on %1$s side - comfortable viewing conditions");

  private final String template;

  ExposureAdvice(String template) {
    this.template = template;
  }

  String render() {
    return template;
  }

  String render(CabinSide side) {
    CabinSide opposite = side == CabinSide.LEFT ? CabinSide.RIGHT : CabinSide.LEFT;
    return String.format(Locale.ROOT, template, side.name(), opposite.name());
  }
}
