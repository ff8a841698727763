package com.sunpath.planner.model;

import java.util.List;

/**
 * Whole-flight rollup of cabin sun exposure.
 *
 * @param leftSideMinutes minutes with the Sun on the left
 * @param rightSideMinutes minutes with the Sun on the right
 * @param overheadMinutes minutes with the Sun overhead
 * @param noSunMinutes minutes at night or with the Sun ahead/behind
 * @param recommendation overall seat advice
 * @param detailedAnalysis one formatted line per side bucket
 */
public record FlightSunAnalysis(
    double leftSideMinutes,
    double rightSideMinutes,
    double overheadMinutes,
    double noSunMinutes,
    String recommendation,
    List<String> detailedAnalysis) {
  public FlightSunAnalysis {
    detailedAnalysis = List.copyOf(detailedAnalysis);
  }
}
