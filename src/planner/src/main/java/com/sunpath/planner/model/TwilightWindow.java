package com.sunpath.planner.model;

import java.time.Instant;

/**
 * Morning and evening bounds of one twilight kind for a calendar day.
 *
 * @param type twilight kind
 * @param start instant the Sun rises through the threshold, {@code null} when it never does
 * @param end instant the Sun sets through the threshold, {@code null} when it never does
 */
public record TwilightWindow(TwilightType type, Instant start, Instant end) {}
