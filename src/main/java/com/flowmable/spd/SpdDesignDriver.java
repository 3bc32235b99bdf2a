package com.flowmable.spd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI driver: loads the primary and sensitivity tables, searches for the best primary
 * subset, prints a report and writes the result artifact and plots.
 * <p>
 * Usage: {@code SpdDesignDriver [config.json]}. Relative data paths resolve against
 * the configuration file's directory (or the working directory without one).
 */
public class SpdDesignDriver {

    private static final Logger logger = LoggerFactory.getLogger(SpdDesignDriver.class);

    public static void main(String[] args) throws Exception {
        SearchConfig config;
        Path baseDir;
        if (args.length > 0) {
            Path configFile = Path.of(args[0]).toAbsolutePath();
            config = SearchConfigLoader.load(configFile);
            baseDir = configFile.getParent();
        } else {
            config = SearchConfig.DEFAULT;
            baseDir = Path.of("").toAbsolutePath();
        }

        ResultSet resultSet = run(config, baseDir);
        printReport(resultSet);
    }

    /**
     * Runs the whole pipeline and persists its outputs.
     *
     * @throws ConfigurationException before any trial runs, if inputs or settings are invalid
     */
    public static ResultSet run(SearchConfig config, Path baseDir) throws IOException {
        config.validate();

        PrimaryTable table = PrimaryTableReader.read(
                baseDir.resolve(config.spdFile()), baseDir.resolve(config.powerFile()));
        NormalizedPrimaries primaries = PrimaryPowerNormalizer.normalize(table, config.surfaceAreaLookup());
        logger.info("Loaded {} primaries on {}", primaries.size(), primaries.support());

        ReceptorSensitivityProvider provider =
                new TabulatedSensitivityProvider(baseDir.resolve(config.sensitivityFile()));
        ReceptorSet receptors = provider.sensitivities(
                primaries.support(), config.receptorClasses(), config.observer());

        SearchOutcome outcome = new PrimarySetSearch(config).run(primaries, receptors);
        ResultSet resultSet = ResultSet.of(outcome, primaries, receptors, config);

        Path outputDir = baseDir.resolve(config.outputDir());
        Path written = ResultSetWriter.write(resultSet, outputDir);
        logger.info("Result set written to {}", written);

        if (config.makePlots()) {
            List<Path> plots = ModulationPlotter.writeAll(resultSet, outputDir);
            logger.info("Wrote {} diagnostic plots to {}", plots.size(), outputDir);
        }
        return resultSet;
    }

    private static void printReport(ResultSet resultSet) {
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("  NOMINAL SPD DESIGN — Primary Set Search Report");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.printf("Subsets tested:   %d (seed %d)%n", resultSet.testedSubsets(), resultSet.seed());
        System.out.printf("Worst shortfall:  %.4f%n", resultSet.worstShortfall());
        System.out.println("Primaries:        " + String.join(", ", resultSet.primaryNames()));

        System.out.println("\n| Direction | Scored | Target | Desired | Achieved | Scale | Diff OK |");
        System.out.println("| :--- | :--- | :--- | :--- | :--- | :--- | :--- |");
        for (StimulusDirection direction : resultSet.directions()) {
            DirectionResult r = resultSet.results().get(direction.name());
            System.out.printf("| %-9s | %-6s | %-8s | %6.3f | %6.3f | %4.2f | %s |%n",
                    direction.name(),
                    direction.scored() ? "yes" : "no",
                    resultSet.receptorClasses().get(direction.primaryTarget()),
                    direction.primaryDesiredContrast(),
                    r.positiveContrast()[direction.primaryTarget()],
                    r.contrastScale(),
                    r.differentialConstraintMet() ? "yes" : "no");
        }
    }
}
