package com.flowmable.spd;

/**
 * Observer description handed to the receptor sensitivity provider.
 * <p>
 * The last three components are optional; null leaves the provider's own default.
 *
 * @param fieldSizeDegrees     Stimulus field size
 * @param pupilDiameterMm      Pupil diameter
 * @param ageYears             Observer age
 * @param fractionBleached     Fraction of photopigment bleached, one entry per receptor class
 * @param oxygenationFraction  Blood oxygenation fraction for the retinal vessel model
 * @param vesselThicknessUm    Retinal vessel thickness for the vessel model
 */
public record ObserverParameters(
        double fieldSizeDegrees,
        double pupilDiameterMm,
        double ageYears,
        double[] fractionBleached,
        Double oxygenationFraction,
        Double vesselThicknessUm
) {

    public static final ObserverParameters DEFAULT = new ObserverParameters(30, 2, 25, null, null, null);

    /**
     * @throws ConfigurationException if a bleaching fraction is outside [0, 1] or the
     *                                vector does not have one entry per receptor class
     */
    public void validate(int receptorCount) {
        if (fractionBleached != null) {
            if (fractionBleached.length != receptorCount) {
                throw new ConfigurationException(String.format(
                        "Need %d bleaching fractions, got %d", receptorCount, fractionBleached.length));
            }
            for (double f : fractionBleached) {
                if (!(f >= 0 && f <= 1)) {
                    throw new ConfigurationException("Bleaching fraction must be in [0, 1], got " + f);
                }
            }
        }
        if (oxygenationFraction != null && !(oxygenationFraction >= 0 && oxygenationFraction <= 1)) {
            throw new ConfigurationException("Oxygenation fraction must be in [0, 1], got " + oxygenationFraction);
        }
        if (vesselThicknessUm != null && !(vesselThicknessUm >= 0)) {
            throw new ConfigurationException("Vessel thickness cannot be negative, got " + vesselThicknessUm);
        }
    }
}
