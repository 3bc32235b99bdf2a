package com.flowmable.spd;

import java.util.List;

/**
 * Source of photoreceptor spectral sensitivities. Implementations are pure functions.
 */
public interface ReceptorSensitivityProvider {

    /**
     * @return Sensitivities on {@code support}, one row per entry of {@code classNames}
     */
    ReceptorSet sensitivities(WavelengthSupport support, List<String> classNames, ObserverParameters observer);
}
