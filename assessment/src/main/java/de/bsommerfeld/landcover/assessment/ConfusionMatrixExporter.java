package de.bsommerfeld.landcover.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.landcover.core.domain.ConfusionMatrix;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes confusion matrices as labelled 2D tables:
 *
 * <pre>
 * {
 *   "labels": ["water", "trees", ...],
 *   "matrix": [[12, 0, ...], [1, 40, ...], ...],
 *   "overallAccuracy": 0.93
 * }
 * </pre>
 *
 * Rows are reference classes, columns predicted classes. Undefined cells of a
 * normalized matrix are written as {@code null}.
 */
@Singleton
public class ConfusionMatrixExporter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ObjectNode toTable(AccuracyReport report, List<String> labels) {
        ConfusionMatrix matrix = report.matrix();
        if (labels.size() != matrix.size()) {
            throw new IllegalArgumentException(labels.size() + " labels for a matrix of size " + matrix.size());
        }
        ObjectNode root = mapper.createObjectNode();
        root.set("labels", labelArray(labels));
        ArrayNode rows = root.putArray("matrix");
        for (int r = 0; r < matrix.size(); r++) {
            ArrayNode row = rows.addArray();
            for (int c = 0; c < matrix.size(); c++) {
                row.add(matrix.count(r, c));
            }
        }
        putNumberOrNull(root, "overallAccuracy", report.overallAccuracy());
        return root;
    }

    public ObjectNode toTable(NormalizedConfusionMatrix normalized) {
        ObjectNode root = mapper.createObjectNode();
        root.set("labels", labelArray(normalized.labels()));
        ArrayNode rows = root.putArray("matrix");
        for (String reference : normalized.labels()) {
            ArrayNode row = rows.addArray();
            for (String predicted : normalized.labels()) {
                double value = normalized.value(reference, predicted);
                if (Double.isNaN(value)) {
                    row.addNull();
                } else {
                    row.add(value);
                }
            }
        }
        return root;
    }

    public String toJson(AccuracyReport report, List<String> labels) {
        return write(toTable(report, labels));
    }

    public String toJson(NormalizedConfusionMatrix normalized) {
        return write(toTable(normalized));
    }

    public void writeTo(Path file, AccuracyReport report, List<String> labels) throws IOException {
        Files.writeString(file, toJson(report, labels));
    }

    public void writeTo(Path file, NormalizedConfusionMatrix normalized) throws IOException {
        Files.writeString(file, toJson(normalized));
    }

    private ArrayNode labelArray(List<String> labels) {
        ArrayNode array = mapper.createArrayNode();
        labels.forEach(array::add);
        return array;
    }

    private static void putNumberOrNull(ObjectNode node, String field, double value) {
        if (Double.isNaN(value)) {
            node.putNull(field);
        } else {
            node.put(field, value);
        }
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize confusion matrix", e);
        }
    }
}
