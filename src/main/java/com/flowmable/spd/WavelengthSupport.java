package com.flowmable.spd;

/**
 * Uniform wavelength sampling shared by every spectral curve in a run.
 *
 * @param startNm First sample wavelength, in nm
 * @param stepNm  Spacing between samples, in nm (positive)
 * @param count   Number of samples
 */
public record WavelengthSupport(double startNm, double stepNm, int count) {

    public WavelengthSupport {
        if (stepNm <= 0) {
            throw new ConfigurationException("Wavelength step must be positive, got " + stepNm);
        }
        if (count < 2) {
            throw new ConfigurationException("Wavelength support needs at least two samples, got " + count);
        }
    }

    public double wavelengthAt(int index) {
        return startNm + index * stepNm;
    }

    public double[] wavelengths() {
        double[] wls = new double[count];
        for (int i = 0; i < count; i++) {
            wls[i] = wavelengthAt(i);
        }
        return wls;
    }

    /**
     * Index of the sample closest to the given wavelength, clamped to the support.
     */
    public int indexOfNearest(double wavelengthNm) {
        long idx = Math.round((wavelengthNm - startNm) / stepNm);
        return (int) Math.max(0, Math.min(count - 1, idx));
    }
}
