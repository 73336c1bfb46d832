package de.anton.wespe.analyser.wespe_analyzer;

import de.anton.wespe.analyser.wespe_analyzer.model.Batch;
import de.anton.wespe.analyser.wespe_analyzer.model.MapAsciiExporter;
import de.anton.wespe.analyser.wespe_analyzer.model.MapWorkbookExporter;
import de.anton.wespe.analyser.wespe_analyzer.service.ConfigurationLoader;
import de.anton.wespe.analyser.wespe_analyzer.service.ReductionConfiguration;
import de.anton.wespe.analyser.wespe_analyzer.service.ReductionService;
import de.anton.wespe.analyser.wespe_analyzer.service.ReductionService.ReductionResult;
import de.anton.wespe.analyser.wespe_analyzer.service.RunDataService;
import de.anton.wespe.analyser.wespe_analyzer.view.CutChartFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Main application class. Loads the configuration, reduces the configured runs and writes the exports.
 * Usage: {@code App [config.json]}; without an argument the bundled defaults are used.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        try {
            ConfigurationLoader loader = new ConfigurationLoader();
            ReductionConfiguration config = args.length > 0 ? loader.load(Path.of(args[0])) : loader.loadDefaults();
            new App().run(config);
        } catch (IOException e) {
            logger.error("Reduction failed: {}", e.getMessage(), e);
            System.exit(1);
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error("Invalid reduction settings: {}", e.getMessage(), e);
            System.exit(2);
        }
    }

    /**
     * Loads, reduces and exports.
     *
     * @return the reduction result
     */
    ReductionResult run(ReductionConfiguration config) throws IOException {
        logger.info("Creating application components...");
        RunDataService dataService = new RunDataService();
        ReductionService reductionService = new ReductionService();

        Batch batch = dataService.loadBatch(config);
        logger.info("\n{}{}", batch.shortSummary(), batch.detailedInfo());

        ReductionResult result = reductionService.reduce(batch, config);
        if (!result.isMergeSuccessful()) {
            logger.warn("No combined map available for {}, nothing exported.", batch.getRunIds());
            return result;
        }
        export(result, config);
        return result;
    }

    private void export(ReductionResult result, ReductionConfiguration config) throws IOException {
        Path output = config.outputDirectoryPath();
        String runs = result.batch.getLoadedRunsLabel();
        if (config.exportAscii()) {
            MapAsciiExporter ascii = new MapAsciiExporter();
            ascii.exportMap(result.displayMap, runs, MapAsciiExporter.timestampedDirectory(output, "Maps"));
            if (result.cut != null) {
                ascii.exportCuts(result.cut, runs, MapAsciiExporter.timestampedDirectory(output, "Cuts"));
            }
        }
        if (config.exportWorkbook()) {
            new MapWorkbookExporter().export(result.displayMap, result.cut, runs,
                    output.resolve("Runs_" + runs.replace(", ", "_") + ".xlsx"));
        }
        if (config.exportChart()) {
            CutChartFactory charts = new CutChartFactory();
            if (result.cut != null) {
                charts.saveAsPng(result.cut, "Runs " + runs, output.resolve("cuts.png"));
            }
            if (result.staticCut != null) {
                charts.saveAsPng(result.staticCut, "Static runs " + runs, output.resolve("static_cuts.png"));
            }
        }
    }
}
