package astro.sewingmachine.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import astro.sewingmachine.linelist.LineDefinition;
import astro.sewingmachine.linelist.LineList;
import astro.sewingmachine.linelist.Window;
import astro.sewingmachine.measure.FlagKind;
import astro.sewingmachine.measure.LineMeasurer;
import astro.sewingmachine.measure.MeasurementSettings;
import astro.sewingmachine.measure.SyntheticSpectra;
import astro.sewingmachine.spectrum.Spectrum;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineListMeasurerTest {

    @Test
    void measuresEveryLineInOrderAndIsolatesFailures() {
        Spectrum spectrum = SyntheticSpectra.spectrum(SyntheticSpectra.boxDip(0.1));
        LineList lineList = LineList.of(
                SyntheticSpectra.line("Fe1"),
                new LineDefinition("off", new Window(5045, 5060), SyntheticSpectra.CONTINUUM),
                new LineDefinition("Fe1-narrow", new Window(5016, 5018), SyntheticSpectra.CONTINUUM));

        SpectrumMeasurement measurement = new LineListMeasurer(new LineMeasurer(MeasurementSettings.defaults()))
                .measure(spectrum, lineList);

        assertThat(measurement.labels()).containsExactly("Fe1", "off", "Fe1-narrow");
        assertThat(measurement.size()).isEqualTo(3);
        assertThat(measurement.ews()[0]).isCloseTo(0.975, within(1e-9));
        assertThat(measurement.ews()[1]).isNaN();
        assertThat(measurement.ews()[2]).isCloseTo(0.2, within(1e-9));
        assertThat(measurement.flags().get(1)).containsExactly(FlagKind.INTEGRATION_OUT_OF_RANGE);
    }

    @Test
    void emptyLineListGivesEmptyRow() {
        Spectrum spectrum = SyntheticSpectra.spectrum(lambda -> 1.0);

        SpectrumMeasurement measurement = new LineListMeasurer(new LineMeasurer(MeasurementSettings.defaults()))
                .measure(spectrum, new LineList(List.of()));

        assertThat(measurement.size()).isZero();
        assertThat(measurement.ews()).isEmpty();
    }

    @Test
    void notifiesListenerForEveryLine() {
        Spectrum spectrum = SyntheticSpectra.spectrum(SyntheticSpectra.boxDip(0.1));
        List<String> seen = new ArrayList<>();

        new LineListMeasurer(new LineMeasurer(MeasurementSettings.defaults()),
                (spectrumId, trace) -> seen.add(spectrumId + ":" + trace.label() + ":" + trace.integrated()))
                .measure("2M0001", spectrum, LineList.of(SyntheticSpectra.line("a"), SyntheticSpectra.line("b")));

        assertThat(seen).containsExactly("2M0001:a:true", "2M0001:b:true");
    }

    @Test
    void unavailableRowIsAllNaN() {
        SpectrumMeasurement measurement = SpectrumMeasurement.unavailable(List.of("a", "b"));

        assertThat(measurement.ews()).containsExactly(Double.NaN, Double.NaN);
        assertThat(measurement.errors()).containsExactly(Double.NaN, Double.NaN);
        assertThat(measurement.flags()).allSatisfy(flags -> assertThat(flags).isEmpty());
    }
}
