package com.flowmable.spd;

import java.util.List;

/**
 * Scores tested subsets by their worst contrast shortfall and picks the winner.
 * <p>
 * For each scoring-relevant direction the achieved positive contrast on the first
 * target receptor is divided by the first desired contrast (1.0 = fully met). A
 * subset's score is {@code max(1 - normalized)} over those directions; lower is better.
 * Ties go to the lowest trial index. NaN scores never win.
 */
public final class OutcomeScorer {

    private OutcomeScorer() {}

    /**
     * @param bestIndex      Index of the winning trial
     * @param worstShortfall Score of every trial, in trial order
     */
    public record Selection(int bestIndex, double[] worstShortfall) {

        public double bestScore() {
            return worstShortfall[bestIndex];
        }
    }

    public static double normalizedContrast(DirectionResult result, StimulusDirection direction) {
        return result.positiveContrast()[direction.primaryTarget()] / direction.primaryDesiredContrast();
    }

    public static double worstShortfall(SubsetTrial trial, List<StimulusDirection> directions) {
        double worst = Double.NEGATIVE_INFINITY;
        boolean any = false;
        for (StimulusDirection direction : directions) {
            if (!direction.scored()) continue;
            any = true;
            double shortfall = 1.0 - normalizedContrast(trial.result(direction), direction);
            if (Double.isNaN(shortfall)) {
                return Double.NaN;
            }
            worst = Math.max(worst, shortfall);
        }
        if (!any) {
            throw new ConfigurationException("No stimulus direction is flagged for scoring");
        }
        return worst;
    }

    public static Selection select(List<SubsetTrial> trials, List<StimulusDirection> directions) {
        double[] scores = new double[trials.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = worstShortfall(trials.get(i), directions);
        }
        return new Selection(bestIndex(scores), scores);
    }

    /**
     * First index holding the minimum score; 0 when every score is NaN.
     */
    public static int bestIndex(double[] scores) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("No trials to select from");
        }
        int best = -1;
        for (int i = 0; i < scores.length; i++) {
            if (Double.isNaN(scores[i])) continue;
            if (best < 0 || scores[i] < scores[best]) {
                best = i;
            }
        }
        return Math.max(best, 0);
    }
}
