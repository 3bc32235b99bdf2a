package com.flowmable.spd;

/**
 * Starting vector handed to the modulation solver.
 */
public enum StartingPolicy {
    BACKGROUND,
    ONES,
    RANDOM
}
