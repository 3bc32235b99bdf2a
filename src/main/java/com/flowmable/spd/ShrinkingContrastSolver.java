package com.flowmable.spd;

import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.PivotSelectionRule;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Default modulation solver: a linear program per contrast level, shrinking the
 * requested contrast until the differential-contrast bound holds.
 * <p>
 * Receptor contrast is linear in the primary settings, so each level is solved
 * exactly with a simplex method:
 * <ul>
 *   <li>silenced receptors: contrast constrained to zero,</li>
 *   <li>targets: L1 distance from {@code scale * desired} minimized,</li>
 *   <li>minimized receptors: L1 contrast magnitude minimized,</li>
 *   <li>every primary within {@code [headroom, 1 - headroom]}, pinned ones at background.</li>
 * </ul>
 * The simplex result does not depend on a starting point, so {@code start} is ignored.
 * The scale runs 1, 1 - step, 1 - 2·step, ... and the search stops with the last
 * attempt once the next scale would fall below the shrink threshold.
 * <p>
 * A target the background does not excite has no defined contrast; the background
 * is returned unchanged (zero attempts, constraint not met) and the trial scores
 * accordingly.
 */
public class ShrinkingContrastSolver implements ModulationSolver {

    private static final Logger logger = LoggerFactory.getLogger(ShrinkingContrastSolver.class);

    private static final int MAX_SIMPLEX_ITERATIONS = 50_000;

    /** Slack on the group bound so that exactly-equal contrasts are not rejected by rounding. */
    private static final double DIFFERENCE_TOLERANCE = 1e-9;

    @Override
    public ModulationSolution solve(ModulationRequest request) {
        double[][] tb = SpectralMath.multiply(request.sensitivities(), request.primaries());
        double[] background = request.background();
        double[] backgroundSpd = SpectralMath.apply(request.primaries(), background);
        if (request.ambientSpd() != null) {
            for (int w = 0; w < backgroundSpd.length; w++) {
                backgroundSpd[w] += request.ambientSpd()[w];
            }
        }
        double[] backgroundExcitation = SpectralMath.apply(request.sensitivities(), backgroundSpd);

        for (int t : request.targets()) {
            if (!(backgroundExcitation[t] > 0)) {
                logger.debug("Background does not excite target receptor {}; returning the background", t);
                return new ModulationSolution(background.clone(), 1.0, false, 0);
            }
        }

        // Row r maps primary settings to contrast on receptor r
        double[][] contrastRows = new double[tb.length][];
        for (int r = 0; r < tb.length; r++) {
            double denom = backgroundExcitation[r] > 0 ? backgroundExcitation[r] : 1.0;
            contrastRows[r] = new double[tb[r].length];
            for (int i = 0; i < tb[r].length; i++) {
                contrastRows[r][i] = tb[r][i] / denom;
            }
        }

        int[] silenced = silenced(tb.length, request);
        double[] desired = request.desiredContrast();

        int attempt = 0;
        while (true) {
            double scale = 1.0 - attempt * request.stepSize();
            double[] scaled = new double[desired.length];
            for (int j = 0; j < desired.length; j++) {
                scaled[j] = desired[j] * scale;
            }

            double[] x = isolate(contrastRows, request, silenced, scaled);
            attempt++;

            double[] targetContrast = new double[request.targets().length];
            double[] delta = SpectralMath.subtract(x, background);
            for (int j = 0; j < targetContrast.length; j++) {
                targetContrast[j] = dot(contrastRows[request.targets()[j]], delta);
            }

            if (groupsWithinBound(targetContrast, request.contrastGroups(), request.maxContrastDifference())) {
                return new ModulationSolution(x, scale, true, attempt);
            }

            double next = 1.0 - attempt * request.stepSize();
            if (next < request.shrinkFactorThreshold()) {
                logger.debug("Differential contrast bound not met down to scale {}; keeping last attempt", scale);
                return new ModulationSolution(x, scale, false, attempt);
            }
        }
    }

    /**
     * True when, within every group, the spread of contrast magnitudes is at most {@code bound}.
     */
    static boolean groupsWithinBound(double[] targetContrast, List<int[]> groups, double bound) {
        for (int[] group : groups) {
            if (group.length < 2) continue;
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (int pos : group) {
                double magnitude = Math.abs(targetContrast[pos]);
                lo = Math.min(lo, magnitude);
                hi = Math.max(hi, magnitude);
            }
            if (hi - lo > bound + DIFFERENCE_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    private double[] isolate(double[][] contrastRows, ModulationRequest request, int[] silenced, double[] desired) {
        double[] background = request.background();
        int nPrimaries = background.length;
        int[] targets = request.targets();
        int[] minimized = request.minimized();

        // Layout: [x_0..x_n-1 | e+_t, e-_t per target | m+_m, m-_m per minimized receptor]
        int targetSlack = nPrimaries;
        int minimizedSlack = targetSlack + 2 * targets.length;
        int nVars = minimizedSlack + 2 * minimized.length;

        double[] objective = new double[nVars];
        for (int v = targetSlack; v < nVars; v++) {
            objective[v] = 1.0;
        }

        double lower = request.headroom();
        double upper = 1.0 - request.headroom();
        boolean[] pinned = new boolean[nPrimaries];
        if (request.pinned() != null) {
            for (int p : request.pinned()) {
                pinned[p] = true;
            }
        }

        List<LinearConstraint> constraints = new ArrayList<>();
        for (int i = 0; i < nPrimaries; i++) {
            double[] unit = new double[nVars];
            unit[i] = 1.0;
            if (pinned[i]) {
                constraints.add(new LinearConstraint(unit, Relationship.EQ, background[i]));
            } else {
                constraints.add(new LinearConstraint(unit, Relationship.GEQ, lower));
                constraints.add(new LinearConstraint(unit, Relationship.LEQ, upper));
            }
        }

        for (int r : silenced) {
            if (isZero(contrastRows[r])) continue;
            constraints.add(new LinearConstraint(
                    widen(contrastRows[r], nVars), Relationship.EQ, dot(contrastRows[r], background)));
        }

        for (int j = 0; j < targets.length; j++) {
            double[] row = widen(contrastRows[targets[j]], nVars);
            row[targetSlack + 2 * j] = -1.0;
            row[targetSlack + 2 * j + 1] = 1.0;
            constraints.add(new LinearConstraint(
                    row, Relationship.EQ, desired[j] + dot(contrastRows[targets[j]], background)));
        }

        for (int j = 0; j < minimized.length; j++) {
            double[] row = widen(contrastRows[minimized[j]], nVars);
            row[minimizedSlack + 2 * j] = -1.0;
            row[minimizedSlack + 2 * j + 1] = 1.0;
            constraints.add(new LinearConstraint(
                    row, Relationship.EQ, dot(contrastRows[minimized[j]], background)));
        }

        PointValuePair solution;
        try {
            solution = new SimplexSolver().optimize(
                    new MaxIter(MAX_SIMPLEX_ITERATIONS),
                    new LinearObjectiveFunction(objective, 0),
                    new LinearConstraintSet(constraints),
                    GoalType.MINIMIZE,
                    new NonNegativeConstraint(true),
                    PivotSelectionRule.BLAND);
        } catch (NoFeasibleSolutionException e) {
            logger.debug("No feasible modulation at this contrast level; falling back to the background");
            return background.clone();
        }

        double[] point = solution.getPoint();
        double[] x = new double[nPrimaries];
        for (int i = 0; i < nPrimaries; i++) {
            x[i] = pinned[i] ? background[i] : Math.min(upper, Math.max(lower, point[i]));
        }
        return x;
    }

    private static int[] silenced(int receptorCount, ModulationRequest request) {
        boolean[] free = new boolean[receptorCount];
        for (int[] set : new int[][]{request.targets(), request.ignored(), request.minimized()}) {
            if (set == null) continue;
            for (int r : set) {
                free[r] = true;
            }
        }
        return IntStream.range(0, receptorCount).filter(r -> !free[r]).toArray();
    }

    private static boolean isZero(double[] row) {
        for (double v : row) {
            if (v != 0) return false;
        }
        return true;
    }

    private static double[] widen(double[] row, int width) {
        double[] out = new double[width];
        System.arraycopy(row, 0, out, 0, row.length);
        return out;
    }

    private static double dot(double[] a, double[] b) {
        double s = 0;
        for (int i = 0; i < a.length; i++) {
            s += a[i] * b[i];
        }
        return s;
    }
}
