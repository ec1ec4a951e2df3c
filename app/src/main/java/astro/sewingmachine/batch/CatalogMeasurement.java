package astro.sewingmachine.batch;

import java.util.List;
import java.util.Objects;

/**
 * EW and error matrices of a catalog run: one row per catalog entry in catalog order, one
 * column per line in line-list order.
 */
public record CatalogMeasurement(List<String> labels, List<CatalogRow> rows) {

    public CatalogMeasurement {
        labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return labels.size();
    }

    public double[][] ewMatrix() {
        double[][] matrix = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            matrix[i] = rows.get(i).measurement().ews();
        }
        return matrix;
    }

    public double[][] errorMatrix() {
        double[][] matrix = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            matrix[i] = rows.get(i).measurement().errors();
        }
        return matrix;
    }

    public long count(RowStatus status) {
        return rows.stream().filter(row -> row.status() == status).count();
    }
}
