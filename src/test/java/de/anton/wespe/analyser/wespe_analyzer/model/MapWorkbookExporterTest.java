package de.anton.wespe.analyser.wespe_analyzer.model;

import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MapWorkbookExporterTest {

    @TempDir Path tempDir;

    private final MapWorkbookExporter exporter = new MapWorkbookExporter();

    private static Workbook open(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return new XSSFWorkbook(in);
        }
    }

    @Test
    void mapSheetHasEnergyRowsAndTimeColumns() throws IOException {
        DelayEnergyMap map = RunTestUtils.map(new double[][]{{1, 2}, {3, Double.NaN}},
                new double[]{1.0, 1.1}, new double[]{0.0, 0.5});
        Path file = tempDir.resolve("out").resolve("Runs_41.xlsx");

        exporter.export(map, null, "41", file);

        try (Workbook workbook = open(file)) {
            assertNotNull(workbook.getSheet(MapWorkbookExporter.SUMMARY_SHEET));
            assertNull(workbook.getSheet(MapWorkbookExporter.CUTS_SHEET));
            Sheet sheet = workbook.getSheet(MapWorkbookExporter.MAP_SHEET);
            Row header = sheet.getRow(0);
            assertEquals("Kinetic energy (eV) / Delay stage values (ps)", header.getCell(0).getStringCellValue());
            assertEquals(0.5, header.getCell(2).getNumericCellValue());
            assertEquals(1.1, sheet.getRow(2).getCell(0).getNumericCellValue());
            assertEquals(2.0, sheet.getRow(2).getCell(1).getNumericCellValue());
            assertEquals(3.0, sheet.getRow(1).getCell(2).getNumericCellValue());
            assertEquals(CellType.BLANK, sheet.getRow(2).getCell(2).getCellType());
        }
    }

    @Test
    void cutsSheetListsCutsAndDifferences() throws IOException {
        DelayEnergyMap map = RunTestUtils.map(new double[][]{{1, 2}, {3, 5}}, new double[]{1.0, 1.1}, new double[]{0.0, 0.1});
        MapCut cut = MapCutExtractor.extract(map, List.of(0.0, 0.1), List.of(0.1), MapAxis.TIME, Aggregation.MEAN);
        MapCutProcessor.difference(cut, 1.0);
        Path file = tempDir.resolve("cuts.xlsx");

        exporter.export(map, cut, "41", file);

        try (Workbook workbook = open(file)) {
            Sheet sheet = workbook.getSheet(MapWorkbookExporter.CUTS_SHEET);
            Row header = sheet.getRow(0);
            assertEquals("E (eV)", header.getCell(0).getStringCellValue());
            assertEquals(cut.getLabel(1), header.getCell(2).getStringCellValue());
            assertEquals("Difference T2-T1", header.getCell(3).getStringCellValue());
            assertEquals(3.0, sheet.getRow(2).getCell(3).getNumericCellValue());

            Sheet summary = workbook.getSheet(MapWorkbookExporter.SUMMARY_SHEET);
            assertEquals("Loaded runs", summary.getRow(0).getCell(0).getStringCellValue());
            assertEquals("41", summary.getRow(0).getCell(1).getStringCellValue());
        }
    }
}
