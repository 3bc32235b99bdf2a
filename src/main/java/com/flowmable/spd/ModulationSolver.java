package com.flowmable.spd;

/**
 * Constrained search for a modulation primary vector.
 * <p>
 * Implementations never fail on an unattainable contrast: they return the closest
 * feasible vector they found. Implementations must be safe to call from several
 * search workers at once.
 */
public interface ModulationSolver {

    ModulationSolution solve(ModulationRequest request);
}
