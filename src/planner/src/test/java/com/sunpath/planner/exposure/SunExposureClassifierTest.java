package com.sunpath.planner.exposure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.sunpath.planner.api.InvalidInputException;
import com.sunpath.planner.model.CabinSide;
import com.sunpath.planner.model.SunExposureSample;
import org.junit.jupiter.api.Test;

class SunExposureClassifierTest {

  @Test
  void eastboundWithSunSouthLightsRightSide() {
    SunExposureSample sample = SunExposureClassifier.classify(90.0, 180.0, 45.0);

    assertEquals(CabinSide.RIGHT, sample.side());
    assertEquals(90.0, sample.relativeBearing(), 1e-9);
    assertEquals(90.0, sample.sunAngle(), 1e-9);
    assertThat(sample.intensity()).isCloseTo(Math.sin(Math.toRadians(45.0)), within(1e-12));
    assertEquals(
        "Intense sun on RIGHT - choose LEFT side if you need to rest or work on screen",
        sample.recommendation());
  }

  @Test
  void sunOffLeftWingLightsLeftSide() {
    SunExposureSample sample = SunExposureClassifier.classify(0.0, 270.0, 45.0);

    assertEquals(CabinSide.LEFT, sample.side());
    assertEquals(-90.0, sample.relativeBearing(), 1e-9);
    assertEquals(
        "Intense sun on LEFT - choose RIGHT side if you need to rest or work on screen",
        sample.recommendation());
  }

  @Test
  void deepNightHasNoSide() {
    SunExposureSample sample = SunExposureClassifier.classify(0.0, 90.0, -10.0);

    assertEquals(CabinSide.NONE, sample.side());
    assertEquals(0.0, sample.intensity());
    assertEquals("Nighttime flight - ideal for rest or stargazing from either side", sample.recommendation());
  }

  @Test
  void twilightNamesTheSideOfTheGlow() {
    SunExposureSample rising = SunExposureClassifier.classify(0.0, 90.0, -2.0);
    SunExposureSample setting = SunExposureClassifier.classify(0.0, 270.0, -4.0);

    assertEquals(CabinSide.NONE, rising.side());
    assertEquals(
        "Sunrise approaching on RIGHT side - perfect for golden hour photography!",
        rising.recommendation());
    assertEquals("Sunset colors visible on LEFT side - grab your camera!", setting.recommendation());
  }

  @Test
  void highSunIsOverhead() {
    SunExposureSample sample = SunExposureClassifier.classify(0.0, 90.0, 75.0);

    assertEquals(CabinSide.OVERHEAD, sample.side());
    assertThat(sample.recommendation()).startsWith("Tropical route");
  }

  @Test
  void sunAheadAndBehindLightNeitherSide() {
    SunExposureSample lowAhead = SunExposureClassifier.classify(0.0, 10.0, 10.0);
    SunExposureSample ahead = SunExposureClassifier.classify(350.0, 10.0, 40.0);
    SunExposureSample behind = SunExposureClassifier.classify(0.0, 180.0, 30.0);

    assertEquals(CabinSide.NONE, lowAhead.side());
    assertEquals("Low sun ahead - beautiful atmospheric views from either side", lowAhead.recommendation());
    assertEquals("Sun ahead - balanced lighting on both sides", ahead.recommendation());
    assertEquals(CabinSide.NONE, behind.side());
    assertEquals(180.0, behind.relativeBearing(), 1e-9);
    assertThat(behind.recommendation()).startsWith("Sun behind");
  }

  @Test
  void sideAdviceGradesByAngleAndIntensity() {
    assertEquals(
        "RIGHT side has beautiful low-angle sunlight - great for aerial photography!",
        SunExposureClassifier.classify(0.0, 90.0, 10.0).recommendation());
    assertEquals(
        "RIGHT side has good natural light - ideal for sightseeing and photos",
        SunExposureClassifier.classify(0.0, 90.0, 40.0).recommendation());
    assertEquals(
        "Gentle sunlight on RIGHT side - comfortable viewing conditions",
        SunExposureClassifier.classify(0.0, 45.0, 40.0).recommendation());
  }

  @Test
  void relativeBearingIsSigned() {
    assertEquals(20.0, SunExposureClassifier.relativeBearing(350.0, 10.0), 1e-9);
    assertEquals(-20.0, SunExposureClassifier.relativeBearing(10.0, 350.0), 1e-9);
    assertEquals(0.0, SunExposureClassifier.intensity(90.0, -1.0));
    assertEquals(0.0, SunExposureClassifier.intensity(0.0, 45.0), 1e-12);
  }

  @Test
  void rejectsInvalidInput() {
    assertThrows(InvalidInputException.class, () -> SunExposureClassifier.classify(Double.NaN, 0.0, 10.0));
    assertThrows(InvalidInputException.class, () -> SunExposureClassifier.classify(0.0, 0.0, 100.0));
  }
}
