package com.flowmable.spd;

import java.util.List;

/**
 * Photoreceptor spectral sensitivities on the run's wavelength support.
 *
 * @param classNames    One name per receptor class, e.g. "L_2deg" or "Mel"
 * @param sensitivities Receptor × wavelength matrix, rows in {@code classNames} order
 */
public record ReceptorSet(List<String> classNames, double[][] sensitivities) {

    public ReceptorSet {
        classNames = List.copyOf(classNames);
        if (classNames.size() != sensitivities.length) {
            throw new ConfigurationException(String.format(
                    "%d receptor names but %d sensitivity rows", classNames.size(), sensitivities.length));
        }
    }

    public int size() {
        return classNames.size();
    }
}
