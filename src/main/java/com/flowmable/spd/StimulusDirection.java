package com.flowmable.spd;

import java.util.Arrays;
import java.util.List;

/**
 * One stimulus direction: which receptors to modulate, which to ignore, and how hard to push.
 * <p>
 * Receptors that are neither targeted, ignored nor minimized are silenced.
 *
 * @param name                   Unique direction name, e.g. "LMS" or "Mel"
 * @param targets                Receptor indices to modulate; the first is the scoring representative
 * @param ignored                Receptor indices left unconstrained
 * @param minimized              Receptor indices whose contrast is minimized rather than pinned to zero
 * @param desiredContrast        Either one value for all targets or one signed value per target
 * @param contrastGroups         Groups of positions within {@code targets} whose achieved contrast
 *                               magnitudes may differ by at most {@code maxContrastDifference}
 * @param maxContrastDifference  Allowed spread of contrast magnitude within each group
 * @param scored                 Whether this direction contributes to subset selection
 */
public record StimulusDirection(
        String name,
        int[] targets,
        int[] ignored,
        int[] minimized,
        double[] desiredContrast,
        List<int[]> contrastGroups,
        double maxContrastDifference,
        boolean scored
) {

    public StimulusDirection {
        ignored = ignored == null ? new int[0] : ignored;
        minimized = minimized == null ? new int[0] : minimized;
        contrastGroups = contrastGroups == null ? List.of() : List.copyOf(contrastGroups);
    }

    public int primaryTarget() {
        return targets[0];
    }

    public double primaryDesiredContrast() {
        return desiredContrast[0];
    }

    /**
     * Desired contrast for every target, expanding a single value to all of them.
     */
    public double[] desiredContrastPerTarget() {
        if (desiredContrast.length == 1) {
            return SpectralMath.filled(targets.length, desiredContrast[0]);
        }
        return desiredContrast.clone();
    }

    /**
     * Receptors pinned to zero contrast: everything not targeted, ignored or minimized.
     */
    public int[] silenced(int receptorCount) {
        boolean[] free = new boolean[receptorCount];
        for (int[] set : new int[][]{targets, ignored, minimized}) {
            for (int r : set) {
                free[r] = true;
            }
        }
        int[] out = new int[receptorCount];
        int n = 0;
        for (int r = 0; r < receptorCount; r++) {
            if (!free[r]) out[n++] = r;
        }
        return Arrays.copyOf(out, n);
    }

    /**
     * @throws ConfigurationException if any index is out of range or the shapes disagree
     */
    public void validate(int receptorCount) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Stimulus direction without a name");
        }
        if (targets == null || targets.length == 0) {
            throw new ConfigurationException("Direction " + name + " has no target receptors");
        }
        if (desiredContrast == null
                || (desiredContrast.length != 1 && desiredContrast.length != targets.length)) {
            throw new ConfigurationException("Direction " + name
                    + " needs one desired contrast or one per target");
        }
        if (desiredContrast[0] == 0) {
            throw new ConfigurationException("Direction " + name + " has zero desired contrast on its first target");
        }
        boolean[] used = new boolean[receptorCount];
        for (int[] set : new int[][]{targets, ignored, minimized}) {
            for (int r : set) {
                if (r < 0 || r >= receptorCount) {
                    throw new ConfigurationException("Direction " + name + " refers to receptor " + r
                            + " but only " + receptorCount + " are defined");
                }
                if (used[r]) {
                    throw new ConfigurationException("Direction " + name + " lists receptor " + r + " more than once");
                }
                used[r] = true;
            }
        }
        for (int[] group : contrastGroups) {
            for (int pos : group) {
                if (pos < 0 || pos >= targets.length) {
                    throw new ConfigurationException("Direction " + name + " groups target position " + pos
                            + " but has " + targets.length + " targets");
                }
            }
        }
        if (maxContrastDifference < 0) {
            throw new ConfigurationException("Direction " + name + " has a negative contrast difference bound");
        }
    }
}
