package com.sunpath.planner.model;

import java.util.List;

/**
 * Payload returned by {@code GET /api/flights/analysis}.
 *
 * @param totalDistanceKm great-circle distance
 * @param totalDurationMinutes flight duration
 * @param initialHeading heading at departure
 * @param initialCompass compass label of the departure heading
 * @param sunEvents sunrise/sunset transitions
 * @param statistics aggregate sun statistics
 * @param analysis cabin side rollup
 * @param timestamp response generation timestamp
 */
public record FlightAnalysisResponse(
    double totalDistanceKm,
    double totalDurationMinutes,
    double initialHeading,
    String initialCompass,
    List<SunEvent> sunEvents,
    TimelineStatistics statistics,
    FlightSunAnalysis analysis,
    String timestamp) {}
