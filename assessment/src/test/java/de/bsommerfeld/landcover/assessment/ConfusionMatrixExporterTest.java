package de.bsommerfeld.landcover.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.landcover.core.domain.ConfusionMatrix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfusionMatrixExporterTest {

    private final ConfusionMatrixExporter exporter = new ConfusionMatrixExporter();

    @TempDir
    Path tempDir;

    @Test
    void toTable_shouldWriteLabelsCountsAndAccuracy() {
        ConfusionMatrix matrix = ConfusionMatrix.of(new long[][] { { 3, 1 }, { 0, 4 } });
        AccuracyReport report = new AccuracyReport(matrix, matrix.overallAccuracy());

        ObjectNode table = exporter.toTable(report, List.of("water", "trees"));

        assertEquals("trees", table.get("labels").get(1).asText());
        assertEquals(1, table.get("matrix").get(0).get(1).asLong());
        assertEquals(0.875, table.get("overallAccuracy").asDouble(), 1e-9);
    }

    @Test
    void toTable_shouldWriteUndefinedCellsAsNull() {
        ConfusionMatrix matrix = ConfusionMatrix.of(new long[][] { { 2, 0 }, { 0, 0 } });
        NormalizedConfusionMatrix normalized = new NormalizedConfusionMatrix(List.of("a", "b"),
                matrix.rowNormalized());

        ObjectNode table = exporter.toTable(normalized);

        assertEquals(1.0, table.get("matrix").get(0).get(0).asDouble(), 1e-9);
        assertTrue(table.get("matrix").get(1).get(0).isNull());
    }

    @Test
    void toTable_shouldRejectLabelCountMismatch() {
        ConfusionMatrix matrix = ConfusionMatrix.builder(2).build();
        AccuracyReport report = new AccuracyReport(matrix, matrix.overallAccuracy());

        assertThrows(IllegalArgumentException.class, () -> exporter.toTable(report, List.of("a")));
    }

    @Test
    void writeTo_shouldProduceParsableJson() throws Exception {
        ConfusionMatrix matrix = ConfusionMatrix.builder(2).build();
        AccuracyReport report = new AccuracyReport(matrix, matrix.overallAccuracy());
        Path file = tempDir.resolve("matrix.json");

        exporter.writeTo(file, report, List.of("a", "b"));

        JsonNode parsed = new ObjectMapper().readTree(file.toFile());
        assertTrue(parsed.get("overallAccuracy").isNull(), "NaN accuracy is exported as null");
        assertEquals(2, parsed.get("matrix").size());
    }
}
