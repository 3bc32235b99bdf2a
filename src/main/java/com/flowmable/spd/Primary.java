package com.flowmable.spd;

/**
 * One power-normalized light-emitting primary.
 *
 * @param name              Identifying name from the input tables
 * @param spd               Normalized spectral power per wavelength sample (all values &gt;= 0)
 * @param totalPowerMw      Measured total power in milliwatts
 * @param surfaceAreaMm2    Emitting surface area used in the normalization
 * @param peakWavelengthNm  Wavelength of the maximum of {@code spd}
 */
public record Primary(
        String name,
        double[] spd,
        double totalPowerMw,
        double surfaceAreaMm2,
        double peakWavelengthNm
) {}
