package com.flowmable.spd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every candidate subset through the filter model and the per-direction
 * modulation design, scores it, and returns the best subset's full bundle.
 * <p>
 * Trials share only read-only inputs and run on a fixed worker pool; each yields
 * its score into its own slot. Only scores are kept while searching; the winner is
 * rebuilt afterwards, which gives the same bundle because a trial's random source
 * is derived from the run seed and the trial index.
 */
public class PrimarySetSearch {

    private static final Logger logger = LoggerFactory.getLogger(PrimarySetSearch.class);

    /** Progress is reported roughly this many times per search. */
    private static final int PROGRESS_TICKS = 50;

    private final SearchConfig config;
    private final ModulationSolver solver;

    public PrimarySetSearch(SearchConfig config) {
        this(config, new ShrinkingContrastSolver());
    }

    public PrimarySetSearch(SearchConfig config, ModulationSolver solver) {
        this.config = config;
        this.solver = solver;
    }

    public SearchOutcome run(NormalizedPrimaries primaries, ReceptorSet receptors) {
        config.validate();
        checkInputs(primaries, receptors);

        long seed = config.randomSeed() != null ? config.randomSeed() : new Random().nextLong();
        List<int[]> subsets = SubsetEnumerator.candidates(
                primaries.peakWavelengths(),
                config.primariesToKeep(),
                config.minSpacingNm(),
                config.bestKnownSubset(),
                config.maxTests(),
                new Random(seed));

        ModulationDesigner designer = ModulationDesigner.from(config, solver, receptors);
        AdjacentChannelFilter filter = config.filterAdjacentPrimaries()
                ? new AdjacentChannelFilter(config.filterMaxSlope())
                : null;

        int workers = Math.min(config.effectiveParallelism(), subsets.size());
        logger.info("Searching over {} primary subsets with {} workers (seed {})", subsets.size(), workers, seed);

        long t0 = System.nanoTime();
        double[] scores = scoreAll(subsets, primaries, designer, filter, seed, workers);
        long elapsedMillis = (System.nanoTime() - t0) / 1_000_000;

        int bestIndex = OutcomeScorer.bestIndex(scores);
        SubsetTrial best = runTrial(subsets.get(bestIndex), bestIndex, primaries, designer, filter, seed);

        logger.info("Search finished in {} ms; best subset {} {} with worst shortfall {}",
                elapsedMillis, Arrays.toString(best.subset()), best.names(), String.format("%.4f", scores[bestIndex]));
        return new SearchOutcome(best, bestIndex, scores, subsets, seed, elapsedMillis);
    }

    /**
     * Builds the filtered primary matrix of one subset and designs every direction on it.
     */
    SubsetTrial runTrial(
            int[] subset,
            int trialIndex,
            NormalizedPrimaries primaries,
            ModulationDesigner designer,
            AdjacentChannelFilter filter,
            long seed) {

        List<String> names = new ArrayList<>(subset.length);
        double[] powers = new double[subset.length];
        for (int c = 0; c < subset.length; c++) {
            Primary p = primaries.get(subset[c]);
            names.add(p.name());
            powers[c] = p.totalPowerMw();
        }

        double[][] preFilter = primaries.matrixFor(subset);
        AdjacentChannelFilter.Filtered filtered = filter != null
                ? filter.apply(preFilter, primaries.support(), config.filterCenterWavelengths())
                : new AdjacentChannelFilter.Filtered(SpectralMath.copy(preFilter), new double[0]);

        Random random = new Random(seed + 31L * (trialIndex + 1));
        Map<String, DirectionResult> results = new LinkedHashMap<>();
        for (StimulusDirection direction : config.directions()) {
            results.put(direction.name(), designer.design(filtered.matrix(), powers, direction, random));
        }

        return new SubsetTrial(subset.clone(), List.copyOf(names), preFilter, filtered.matrix(),
                filtered.crossoverWavelengthsNm(), results);
    }

    private double[] scoreAll(
            List<int[]> subsets,
            NormalizedPrimaries primaries,
            ModulationDesigner designer,
            AdjacentChannelFilter filter,
            long seed,
            int workers) {

        int n = subsets.size();
        int progressInterval = Math.max(1, n / PROGRESS_TICKS);
        AtomicInteger completed = new AtomicInteger();

        List<Callable<Double>> tasks = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            final int trialIndex = i;
            tasks.add(() -> {
                SubsetTrial trial = runTrial(subsets.get(trialIndex), trialIndex, primaries, designer, filter, seed);
                double score = OutcomeScorer.worstShortfall(trial, config.directions());
                int done = completed.incrementAndGet();
                if (config.verbose() && (done % progressInterval == 0 || done == n)) {
                    logger.info("Tested {} / {} subsets", done, n);
                }
                return score;
            });
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, workers), workerThreads());
        try {
            List<Future<Double>> futures = pool.invokeAll(tasks);
            double[] scores = new double[n];
            for (int i = 0; i < n; i++) {
                scores[i] = futures.get(i).get();
            }
            return scores;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Primary set search interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Search trial failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private void checkInputs(NormalizedPrimaries primaries, ReceptorSet receptors) {
        if (receptors.size() != config.receptorClasses().size()) {
            throw new ConfigurationException(String.format("Configuration names %d receptor classes, got %d sensitivities",
                    config.receptorClasses().size(), receptors.size()));
        }
        for (double[] row : receptors.sensitivities()) {
            if (row.length != primaries.support().count()) {
                throw new ConfigurationException(String.format(
                        "Sensitivities have %d wavelength samples, primaries have %d",
                        row.length, primaries.support().count()));
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "spd-search-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
