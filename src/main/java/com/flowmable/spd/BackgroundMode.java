package com.flowmable.spd;

/**
 * How the background primary vector of a modulation is chosen.
 */
public enum BackgroundMode {
    /** Every primary at half output. */
    UNIFORM,
    /** Inversely weighted by measured total power, symmetric about half output. */
    POWER_WEIGHTED
}
