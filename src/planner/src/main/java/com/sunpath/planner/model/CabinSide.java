package com.sunpath.planner.model;

/** Cabin side receiving direct sunlight. */
public enum CabinSide {
  LEFT,
  RIGHT,
  OVERHEAD,
  NONE
}
