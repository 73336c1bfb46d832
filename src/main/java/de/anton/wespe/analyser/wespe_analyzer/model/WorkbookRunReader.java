package de.anton.wespe.analyser.wespe_analyzer.model;

import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads runs stored as Excel workbooks, one file per run at {@code <runDir>/<run>/<run>_events.xlsx}.
 * <ul>
 *     <li>Event sheet: the sheet whose name contains the detector id, otherwise the first sheet that is
 *     not the parameter sheet. Row 1 holds the channel names, every further row one electron.</li>
 *     <li>Required channels: {@code energy}, {@code bunchID}, {@code microbunchID}.</li>
 *     <li>Optional channels: {@code delay} (absent for static runs), {@code BAM}, {@code GMDBDA_Electrons},
 *     {@code mono}, {@code Pulse_Energy_DiodeBB}.</li>
 *     <li>Sheet "Parameters": label/value pairs with the analyzer settings {@code kinenergie[_xx]} and
 *     {@code passenergie[_xx]}, where xx are the last two characters of the detector id.</li>
 * </ul>
 */
public class WorkbookRunReader implements RunReader {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookRunReader.class);

    static final String FILE_SUFFIX = "_events.xlsx";
    static final String PARAMETER_SHEET = "Parameters";

    static final String HEADER_ENERGY = "energy";
    static final String HEADER_DELAY = "delay";
    static final String HEADER_MACROBUNCH = "bunchID";
    static final String HEADER_MICROBUNCH = "microbunchID";
    static final String HEADER_BAM = "BAM";
    static final String HEADER_GMD = "GMDBDA_Electrons";
    static final String HEADER_MONO = "mono";
    static final String HEADER_DIODE = "Pulse_Energy_DiodeBB";

    static final String PARAM_KINETIC_ENERGY = "kinenergie";
    static final String PARAM_PASS_ENERGY = "passenergie";

    /** Location of a run's workbook below the run directory. */
    public static Path workbookPath(Path runDirectory, String runId) {
        return runDirectory.resolve(runId).resolve(runId + FILE_SUFFIX);
    }

    @Override
    public Run read(Path runDirectory, String runId, String detector) throws RunLoadException {
        Objects.requireNonNull(runDirectory, "Run directory cannot be null.");
        Objects.requireNonNull(runId, "Run id cannot be null.");
        Objects.requireNonNull(detector, "Detector cannot be null.");
        Path file = workbookPath(runDirectory, runId);
        logger.info("Reading run {} ({}) from {}", runId, detector, file);
        if (!Files.isRegularFile(file)) {
            throw new RunLoadException(runId, "Workbook not found: " + file);
        }

        try (InputStream fis = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(fis)) {

            Sheet eventSheet = findEventSheet(workbook, detector);
            if (eventSheet == null) {
                throw new RunLoadException(runId, "No event sheet found in " + file.getFileName());
            }
            Map<String, Integer> columns = readHeader(runId, eventSheet);
            for (String required : List.of(HEADER_ENERGY, HEADER_MACROBUNCH, HEADER_MICROBUNCH)) {
                if (!columns.containsKey(required)) {
                    throw new RunLoadException(runId, "Required channel '" + required
                            + "' missing in sheet '" + eventSheet.getSheetName() + "'.");
                }
            }
            boolean staticScan = !columns.containsKey(HEADER_DELAY);
            double staticTime = staticScan ? parseStaticTime(runId) : Double.NaN;

            EventSet events = readEvents(eventSheet, columns, staticTime);
            if (events.isEmpty()) {
                throw new RunLoadException(runId, "Sheet '" + eventSheet.getSheetName() + "' holds no valid events.");
            }

            Map<String, Double> parameters = readParameters(workbook.getSheet(PARAMETER_SHEET));
            int kineticEnergy = (int) Math.round(requireParameter(runId, parameters, PARAM_KINETIC_ENERGY, detector));
            int passEnergy = (int) Math.round(requireParameter(runId, parameters, PARAM_PASS_ENERGY, detector));

            RunMetadata metadata = RunMetadata.derive(runId, detector, kineticEnergy, passEnergy, staticScan, events);
            logger.info("Run {} loaded: {} electrons, static={}", runId, events.size(), staticScan);
            return new Run(events, metadata);

        } catch (RunLoadException rle) {
            logger.error("Cannot load run {}: {}", runId, rle.getMessage());
            throw rle;
        } catch (IOException ioe) {
            logger.error("IO error reading run workbook: {}", file, ioe);
            throw new RunLoadException(runId, "IO error reading " + file.getFileName() + ": " + ioe.getMessage(), ioe);
        } catch (Exception e) {
            logger.error("Error processing run workbook: {}", file, e);
            throw new RunLoadException(runId, "Error processing " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Sheet named after the detector, else the first sheet that is not the parameter sheet. */
    private Sheet findEventSheet(Workbook workbook, String detector) {
        Sheet fallback = null;
        for (Sheet sheet : workbook) {
            String name = sheet.getSheetName();
            if (PARAMETER_SHEET.equalsIgnoreCase(name)) continue;
            if (name.contains(detector)) return sheet;
            if (fallback == null) fallback = sheet;
        }
        if (fallback != null) {
            logger.debug("No sheet named after detector '{}', using '{}'.", detector, fallback.getSheetName());
        }
        return fallback;
    }

    private Map<String, Integer> readHeader(String runId, Sheet sheet) throws RunLoadException {
        DataFormatter formatter = new DataFormatter();
        FormulaEvaluator evaluator = sheet.getWorkbook().getCreationHelper().createFormulaEvaluator();
        Row headerRow = sheet.getRow(0);
        if (headerRow == null) {
            throw new RunLoadException(runId, "Sheet '" + sheet.getSheetName() + "' is missing the header row (Row 1).");
        }
        Map<String, Integer> columns = new HashMap<>();
        for (Cell cell : headerRow) {
            if (cell == null) continue;
            String header = getCellValueAsString(cell, formatter, evaluator).trim();
            if (!header.isEmpty()) {
                columns.put(header, cell.getColumnIndex());
            }
        }
        logger.debug("Channels in sheet '{}': {}", sheet.getSheetName(), columns.keySet());
        return columns;
    }

    private EventSet readEvents(Sheet sheet, Map<String, Integer> columns, double staticTime) {
        DataFormatter formatter = new DataFormatter();
        FormulaEvaluator evaluator = sheet.getWorkbook().getCreationHelper().createFormulaEvaluator();
        int capacity = Math.max(sheet.getLastRowNum(), 0);
        List<double[]> channels = new ArrayList<>();
        for (int c = 0; c < 8; c++) channels.add(new double[capacity]);

        int energyCol = columns.get(HEADER_ENERGY);
        int macroCol = columns.get(HEADER_MACROBUNCH);
        int microCol = columns.get(HEADER_MICROBUNCH);
        int delayCol = columns.getOrDefault(HEADER_DELAY, -1);
        int[] optionalCols = {
                columns.getOrDefault(HEADER_BAM, -1),
                columns.getOrDefault(HEADER_GMD, -1),
                columns.getOrDefault(HEADER_MONO, -1),
                columns.getOrDefault(HEADER_DIODE, -1)};

        int count = 0;
        int skipped = 0;
        for (int i = 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (row == null) continue;
            double energy = getCellValueAsDouble(row.getCell(energyCol), formatter, evaluator);
            double macro = getCellValueAsDouble(row.getCell(macroCol), formatter, evaluator);
            double micro = getCellValueAsDouble(row.getCell(microCol), formatter, evaluator);
            double time = delayCol >= 0 ? getCellValueAsDouble(row.getCell(delayCol), formatter, evaluator) : staticTime;
            if (Double.isNaN(energy) || Double.isNaN(macro) || Double.isNaN(micro) || Double.isNaN(time)) {
                skipped++;
                continue;
            }
            channels.get(0)[count] = energy;
            channels.get(1)[count] = time;
            channels.get(2)[count] = macro;
            channels.get(3)[count] = micro;
            for (int k = 0; k < optionalCols.length; k++) {
                channels.get(4 + k)[count] = optionalCols[k] >= 0
                        ? getCellValueAsDouble(row.getCell(optionalCols[k]), formatter, evaluator)
                        : Double.NaN;
            }
            count++;
        }
        if (skipped > 0) {
            logger.warn("Skipped {} rows with missing required values in sheet '{}'.", skipped, sheet.getSheetName());
        }
        final int n = count;
        double[][] trimmed = channels.stream().map(values -> Arrays.copyOf(values, n)).toArray(double[][]::new);
        return new EventSet(trimmed[0], trimmed[1], trimmed[2], trimmed[3],
                optionalCols[0] >= 0 ? trimmed[4] : null,
                optionalCols[1] >= 0 ? trimmed[5] : null,
                optionalCols[2] >= 0 ? trimmed[6] : null,
                optionalCols[3] >= 0 ? trimmed[7] : null);
    }

    /** Label in column A, numeric value in column B. */
    private Map<String, Double> readParameters(Sheet sheet) {
        Map<String, Double> parameters = new HashMap<>();
        if (sheet == null) {
            return parameters;
        }
        DataFormatter formatter = new DataFormatter();
        FormulaEvaluator evaluator = sheet.getWorkbook().getCreationHelper().createFormulaEvaluator();
        for (Row row : sheet) {
            Cell labelCell = row.getCell(0);
            if (labelCell == null) continue;
            String label = getCellValueAsString(labelCell, formatter, evaluator).trim();
            double value = getCellValueAsDouble(row.getCell(1), formatter, evaluator);
            if (!label.isEmpty() && !Double.isNaN(value)) {
                parameters.put(label, value);
            }
        }
        return parameters;
    }

    private double requireParameter(String runId, Map<String, Double> parameters, String name, String detector)
            throws RunLoadException {
        String suffix = detector.length() >= 2 ? detector.substring(detector.length() - 2) : detector;
        Double value = parameters.get(name + "_" + suffix);
        if (value == null) {
            value = parameters.get(name);
        }
        if (value == null) {
            throw new RunLoadException(runId, "Parameter '" + name + "' (or '" + name + "_" + suffix + "') not found.");
        }
        return value;
    }

    private double parseStaticTime(String runId) throws RunLoadException {
        try {
            return Integer.parseInt(runId.trim());
        } catch (NumberFormatException e) {
            throw new RunLoadException(runId, "Static run needs a numeric run id to label its time axis.", e);
        }
    }

    /** Safely gets cell value as String, evaluating formulas. */
    private String getCellValueAsString(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) return "";
        try {
            return formatter.formatCellValue(cell, evaluator);
        } catch (Exception e) {
            logger.warn("Could not format cell value at {}: {}", cell.getAddress(), e.getMessage());
            return "";
        }
    }

    /** Numeric cell value, NaN for blank or unparsable cells. */
    private double getCellValueAsDouble(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) return Double.NaN;
        CellType type = cell.getCellType() == CellType.FORMULA ? evaluator.evaluateFormulaCell(cell) : cell.getCellType();
        if (type == CellType.NUMERIC) {
            return cell.getNumericCellValue();
        }
        if (type == CellType.BLANK) {
            return Double.NaN;
        }
        String text = getCellValueAsString(cell, formatter, evaluator).trim().replace(',', '.');
        if (text.isEmpty()) return Double.NaN;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            logger.trace("Non-numeric cell at {}: '{}'", cell.getAddress(), text);
            return Double.NaN;
        }
    }
}
