package astro.sewingmachine.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import astro.sewingmachine.catalog.CatalogEntry;
import astro.sewingmachine.linelist.LineList;
import astro.sewingmachine.measure.LineMeasurer;
import astro.sewingmachine.measure.MeasurementSettings;
import astro.sewingmachine.measure.SyntheticSpectra;
import astro.sewingmachine.spectrum.Spectrum;
import astro.sewingmachine.spectrum.SpectrumProvider;
import astro.sewingmachine.spectrum.SpectrumUnavailableException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;

class CatalogMeasurerTest {

    private static final LineList LINES = LineList.of(SyntheticSpectra.line("Fe1"), SyntheticSpectra.line("Fe1-copy"));

    private final LineListMeasurer lineListMeasurer = new LineListMeasurer(new LineMeasurer(MeasurementSettings.defaults()));

    @Test
    void missingSpectrumBecomesNaNRowWithoutAffectingNeighbours() {
        List<CatalogEntry> entries = List.of(
                CatalogEntry.of(0, "4102", "2M0001"),
                CatalogEntry.of(1, "4102", "missing"),
                CatalogEntry.of(2, "4103", "2M0003"));

        CatalogMeasurement measurement = new CatalogMeasurer(new StubProvider(), lineListMeasurer).measure(entries, LINES);

        assertThat(measurement.rowCount()).isEqualTo(3);
        assertThat(measurement.columnCount()).isEqualTo(2);
        assertThat(measurement.rows()).extracting(CatalogRow::status)
                .containsExactly(RowStatus.MEASURED, RowStatus.UNAVAILABLE, RowStatus.MEASURED);
        double[][] ews = measurement.ewMatrix();
        assertThat(ews[0][0]).isCloseTo(0.975, within(1e-9));
        assertThat(ews[1]).containsExactly(Double.NaN, Double.NaN);
        assertThat(ews[2][1]).isCloseTo(0.975, within(1e-9));
        assertThat(measurement.errorMatrix()[1]).containsExactly(Double.NaN, Double.NaN);
    }

    @Test
    void undecodableIdentifierBecomesFormatErrorRow() {
        byte[] invalidUtf8 = {(byte) 0xC3, (byte) 0x28};
        List<CatalogEntry> entries = List.of(
                new CatalogEntry(0, "4102".getBytes(StandardCharsets.UTF_8), invalidUtf8),
                new CatalogEntry(1, 4102, "2M0002".getBytes(StandardCharsets.UTF_8)));

        CatalogMeasurement measurement = new CatalogMeasurer(new StubProvider(), lineListMeasurer).measure(entries, LINES);

        assertThat(measurement.rows().get(0).status()).isEqualTo(RowStatus.FORMAT_ERROR);
        assertThat(measurement.rows().get(0).id()).isEqualTo("row-0");
        assertThat(measurement.rows().get(1).status()).isEqualTo(RowStatus.MEASURED);
        assertThat(measurement.rows().get(1).id()).isEqualTo("2M0002");
        assertThat(measurement.count(RowStatus.FORMAT_ERROR)).isEqualTo(1);
    }

    @Test
    void unexpectedFailureIsRecordedAsFailedRow() {
        SpectrumProvider provider = entry -> {
            throw new IllegalStateException("corrupt data");
        };

        CatalogMeasurement measurement = new CatalogMeasurer(provider, lineListMeasurer)
                .measure(List.of(CatalogEntry.of(0, "4102", "2M0001")), LINES);

        assertThat(measurement.rows().get(0).status()).isEqualTo(RowStatus.FAILED);
        assertThat(measurement.ewMatrix()[0]).containsExactly(Double.NaN, Double.NaN);
    }

    @Test
    void parallelRunKeepsCatalogOrder() {
        List<CatalogEntry> entries = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            entries.add(CatalogEntry.of(i, "field", i % 7 == 3 ? "missing" : "2M" + i));
        }
        StubProvider provider = new StubProvider();

        CatalogMeasurement measurement = new CatalogMeasurer(provider, lineListMeasurer, 4, 10).measure(entries, LINES);

        assertThat(measurement.rowCount()).isEqualTo(40);
        for (int i = 0; i < 40; i++) {
            CatalogRow row = measurement.rows().get(i);
            if (i % 7 == 3) {
                assertThat(row.status()).isEqualTo(RowStatus.UNAVAILABLE);
            } else {
                assertThat(row.id()).isEqualTo("2M" + i);
                assertThat(row.measurement().ews()[0]).isCloseTo(0.975, within(1e-9));
            }
        }
        assertThat(provider.threadNames).allSatisfy(name -> assertThat(name).startsWith("ew-worker-"));
    }

    @Test
    void emptyCatalogGivesEmptyMatrix() {
        CatalogMeasurement measurement = new CatalogMeasurer(new StubProvider(), lineListMeasurer, 2, 1).measure(List.of(), LINES);

        assertThat(measurement.rowCount()).isZero();
        assertThat(measurement.labels()).containsExactly("Fe1", "Fe1-copy");
    }

    @Test
    void rejectsInvalidThreadCount() {
        assertThatThrownBy(() -> new CatalogMeasurer(new StubProvider(), lineListMeasurer, 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class StubProvider implements SpectrumProvider {

        private final Set<String> threadNames = ConcurrentHashMap.newKeySet();

        @Override
        public Spectrum fetch(CatalogEntry entry) {
            threadNames.add(Thread.currentThread().getName());
            if (entry.objectId().equals("missing")) {
                throw new SpectrumUnavailableException("No spectrum for " + entry.objectId());
            }
            return SyntheticSpectra.spectrum(SyntheticSpectra.boxDip(0.1));
        }
    }
}
