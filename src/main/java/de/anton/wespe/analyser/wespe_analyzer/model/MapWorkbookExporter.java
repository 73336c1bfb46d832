package de.anton.wespe.analyser.wespe_analyzer.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exports a reduced map (and optionally its cuts) to an Excel workbook with the sheets
 * "Summary", "Map" and "Cuts".
 */
public class MapWorkbookExporter {

    private static final Logger logger = LoggerFactory.getLogger(MapWorkbookExporter.class);

    static final String SUMMARY_SHEET = "Summary";
    static final String MAP_SHEET = "Map";
    static final String CUTS_SHEET = "Cuts";
    private static final int LABEL_COLUMN_WIDTH = 28 * 256;
    private static final int VALUE_COLUMN_WIDTH = 40 * 256;

    /**
     * Writes the workbook.
     *
     * @param map        map to export, energy in column A and one column per time coordinate
     * @param cut        cuts to export, may be null
     * @param loadedRuns run list label
     * @param file       target {@code .xlsx}
     */
    public void export(DelayEnergyMap map, MapCut cut, String loadedRuns, Path file) throws IOException {
        Objects.requireNonNull(map, "Map cannot be null.");
        if (file == null) {
            throw new IllegalArgumentException("Output file path cannot be null.");
        }
        logger.info("Starting workbook export of '{}' to: {}", map.getName(), file);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Workbook workbook = new XSSFWorkbook(); OutputStream fileOut = Files.newOutputStream(file)) {
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(headerFont);

            writeSummary(workbook.createSheet(SUMMARY_SHEET), headerStyle, map, cut, loadedRuns);
            writeMap(workbook.createSheet(MAP_SHEET), headerStyle, map);
            if (cut != null && cut.size() > 0) {
                writeCuts(workbook.createSheet(CUTS_SHEET), headerStyle, cut);
            }

            logger.debug("Writing workbook to file...");
            workbook.write(fileOut);
            logger.info("Workbook export completed successfully to: {}", file);
        } catch (IOException e) {
            logger.error("IOException during workbook export to {}", file, e);
            throw e;
        } catch (Exception e) {
            logger.error("Unexpected error during workbook export to {}", file, e);
            throw new IOException("Unexpected error during workbook export: " + e.getMessage(), e);
        }
    }

    private void writeSummary(Sheet sheet, CellStyle headerStyle, DelayEnergyMap map, MapCut cut, String loadedRuns) {
        List<String[]> lines = new ArrayList<>();
        lines.add(new String[]{"Loaded runs", loadedRuns});
        lines.add(new String[]{"Map", map.getName()});
        lines.add(new String[]{"Type", map.getType().name()});
        lines.add(new String[]{"Energy step (eV)", String.valueOf(map.getEnergyStep())});
        lines.add(new String[]{map.getOrdinate().getStepLabel() + " (" + map.getOrdinate().getUnits() + ")",
                String.valueOf(map.getTimeStep())});
        lines.add(new String[]{"Energy axis", map.getEnergyAxis().getLabel()});
        lines.add(new String[]{"Time axis", map.getTimeAxis().getLabel()});
        if (map.getTimeZero() != null) {
            lines.add(new String[]{"Time zero (ps)", String.valueOf(map.getTimeZero())});
        }
        lines.add(new String[]{"Normalized", map.isNormalized() ? "True" : "False"});
        lines.add(new String[]{"Merge successful", map.isMergeSuccessful() ? "True" : "False"});
        if (cut != null) {
            lines.add(new String[]{"Cuts across", cut.getCutAxis().getLabel()});
            for (int i = 0; i < cut.size(); i++) {
                lines.add(new String[]{"Cut " + (i + 1), cut.getLabel(i) + (cut.hasData(i) ? "" : " (no data)")});
            }
            if (cut.hasFit()) {
                lines.add(new String[]{"Peak fit", cut.getFit().toLabel(cut.getCoordinateVariableName(), cut.getCoordinateUnits())});
            }
        }
        int rowNum = 0;
        for (String[] line : lines) {
            Row row = sheet.createRow(rowNum++);
            Cell label = row.createCell(0);
            label.setCellValue(line[0]);
            label.setCellStyle(headerStyle);
            row.createCell(1).setCellValue(line[1]);
        }
        sheet.setColumnWidth(0, LABEL_COLUMN_WIDTH);
        sheet.setColumnWidth(1, VALUE_COLUMN_WIDTH);
    }

    private void writeMap(Sheet sheet, CellStyle headerStyle, DelayEnergyMap map) {
        double[] energy = map.getEnergyCoordinates();
        double[] time = map.getTimeCoordinates();
        Row headerRow = sheet.createRow(0);
        Cell corner = headerRow.createCell(0);
        corner.setCellValue(map.getEnergyAxis().getLabel() + " (eV) / " + map.getTimeAxis().getLabel()
                + " (" + map.getTimeUnits() + ")");
        corner.setCellStyle(headerStyle);
        for (int i = 0; i < time.length; i++) {
            Cell cell = headerRow.createCell(i + 1);
            cell.setCellValue(time[i]);
            cell.setCellStyle(headerStyle);
        }
        for (int j = 0; j < energy.length; j++) {
            Row row = sheet.createRow(j + 1);
            createNumericCell(row, 0, energy[j]);
            for (int i = 0; i < time.length; i++) {
                createNumericCell(row, i + 1, map.getValue(i, j));
            }
        }
        sheet.setColumnWidth(0, LABEL_COLUMN_WIDTH);
    }

    private void writeCuts(Sheet sheet, CellStyle headerStyle, MapCut cut) {
        List<String> headers = new ArrayList<>();
        List<double[]> columns = new ArrayList<>();
        headers.add(cut.getCoordinateVariableName() + " (" + cut.getCoordinateUnits() + ")");
        columns.add(cut.getCoordinates());
        for (int i = 0; i < cut.size(); i++) {
            headers.add(cut.getLabel(i));
            columns.add(cut.getCut(i));
        }
        headers.addAll(cut.getDifferenceLabels());
        columns.addAll(cut.getDifferenceCuts());

        Row headerRow = sheet.createRow(0);
        for (int c = 0; c < headers.size(); c++) {
            Cell cell = headerRow.createCell(c);
            cell.setCellValue(headers.get(c));
            cell.setCellStyle(headerStyle);
        }
        int length = columns.get(0).length;
        for (int k = 0; k < length; k++) {
            Row row = sheet.createRow(k + 1);
            for (int c = 0; c < columns.size(); c++) {
                createNumericCell(row, c, columns.get(c)[k]);
            }
        }
        for (int c = 0; c < headers.size(); c++) {
            sheet.setColumnWidth(c, c == 0 ? LABEL_COLUMN_WIDTH / 2 : VALUE_COLUMN_WIDTH);
        }
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}
