package com.sunpath.planner.exposure;

import com.sunpath.planner.model.CabinSide;
import java.util.Locale;

/** Whole-flight seat advice templates. */
enum FlightAdvice {
  RED_EYE("Red-eye flight - minimal sun exposure. Perfect for sleeping or catching sunrise/sunset moments!"),
  TROPICAL("Tropical route with overhead sun - both sides great for cloud photography and ocean views"),
  DOMINANT_SIDE("%1$s side has most sun exposure. Choose %2$s for work/rest, %1$s for sightseeing and natural light"),
  BRIGHTER_SIDE("%1$s side has more sunlight - good for photography and scenic views. %2$s is quieter"),
  FULL_DAYTIME("Full daytime flight - great visibility on both sides. Enjoy the aerial views!"),
  INCLUDES_SUNRISE("Flight includes sunrise! Check sun events below for best viewing side and timing"),
  INCLUDES_SUNSET("Flight includes sunset! Check sun events below for best viewing side and timing"),
  BALANCED("Balanced sun exposure - both sides offer good views. Choose based on your preference!");

  private final String template;

  FlightAdvice(String template) {
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
