package com.sunpath.planner.model;

/** Day/night transition kind seen from the aircraft. */
public enum SunEventType {
  SUNRISE,
  SUNSET
}
