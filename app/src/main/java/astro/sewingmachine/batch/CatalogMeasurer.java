package astro.sewingmachine.batch;

import astro.sewingmachine.catalog.CatalogEntry;
import astro.sewingmachine.catalog.CatalogFormatException;
import astro.sewingmachine.linelist.LineList;
import astro.sewingmachine.spectrum.Spectrum;
import astro.sewingmachine.spectrum.SpectrumProvider;
import astro.sewingmachine.spectrum.SpectrumUnavailableException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Measures a line list in every spectrum of a catalog. A row whose spectrum is missing or
 * whose identifiers cannot be decoded becomes an all-NaN row; the other rows are unaffected.
 * With more than one thread, rows are measured on a fixed pool and each task writes only its
 * own row slot.
 */
public class CatalogMeasurer {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogMeasurer.class);
    static final String MDC_SPECTRUM = "spectrum";

    private final SpectrumProvider spectrumProvider;
    private final LineListMeasurer lineListMeasurer;
    private final int threads;
    private final int progressInterval;

    public CatalogMeasurer(SpectrumProvider spectrumProvider, LineListMeasurer lineListMeasurer) {
        this(spectrumProvider, lineListMeasurer, 1, 500);
    }

    public CatalogMeasurer(SpectrumProvider spectrumProvider, LineListMeasurer lineListMeasurer, int threads, int progressInterval) {
        this.spectrumProvider = Objects.requireNonNull(spectrumProvider, "spectrumProvider");
        this.lineListMeasurer = Objects.requireNonNull(lineListMeasurer, "lineListMeasurer");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be at least 1");
        }
        this.threads = threads;
        this.progressInterval = progressInterval;
    }

    public CatalogMeasurement measure(List<CatalogEntry> entries, LineList lineList) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(lineList, "lineList");
        CatalogRow[] rows = new CatalogRow[entries.size()];
        AtomicInteger completed = new AtomicInteger();
        LOGGER.info("Measuring {} lines in {} spectra using {} thread(s)", lineList.size(), entries.size(), threads);

        if (threads == 1 || entries.size() < 2) {
            for (int i = 0; i < entries.size(); i++) {
                rows[i] = measureRow(entries.get(i), lineList);
                reportProgress(completed.incrementAndGet(), entries.size());
            }
        } else {
            runParallel(entries, lineList, rows, completed);
        }

        CatalogMeasurement measurement = new CatalogMeasurement(lineList.labels(), Arrays.asList(rows));
        LOGGER.info("Finished catalog: {} measured, {} unavailable, {} with bad identifiers, {} failed",
                measurement.count(RowStatus.MEASURED), measurement.count(RowStatus.UNAVAILABLE),
                measurement.count(RowStatus.FORMAT_ERROR), measurement.count(RowStatus.FAILED));
        return measurement;
    }

    private void runParallel(List<CatalogEntry> entries, LineList lineList, CatalogRow[] rows, AtomicInteger completed) {
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, entries.size()), runnable -> {
            Thread thread = new Thread(runnable, "ew-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<?>> futures = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                int index = i;
                futures.add(executor.submit(() -> {
                    rows[index] = measureRow(entries.get(index), lineList);
                    reportProgress(completed.incrementAndGet(), entries.size());
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Catalog measurement interrupted", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Catalog measurement worker failed", ex.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    CatalogRow measureRow(CatalogEntry entry, LineList lineList) {
        String id = entry.displayId();
        MDC.put(MDC_SPECTRUM, id);
        try {
            String objectId = entry.objectId();
            String location = entry.locationKey();
            Spectrum spectrum = spectrumProvider.fetch(entry);
            SpectrumMeasurement measurement = lineListMeasurer.measure(objectId, spectrum, lineList);
            LOGGER.debug("Measured {} in {}", objectId, location);
            return new CatalogRow(objectId, RowStatus.MEASURED, measurement);
        } catch (SpectrumUnavailableException ex) {
            LOGGER.warn("Spectrum missing for row {} ({}): {}", entry.row(), id, ex.getMessage());
            return new CatalogRow(id, RowStatus.UNAVAILABLE, SpectrumMeasurement.unavailable(lineList.labels()));
        } catch (CatalogFormatException ex) {
            LOGGER.warn("Unreadable identifiers in row {}: {}", entry.row(), ex.getMessage());
            return new CatalogRow(id, RowStatus.FORMAT_ERROR, SpectrumMeasurement.unavailable(lineList.labels()));
        } catch (RuntimeException ex) {
            LOGGER.error("Measurement failed for row {} ({}): {}", entry.row(), id, ex.getMessage(), ex);
            return new CatalogRow(id, RowStatus.FAILED, SpectrumMeasurement.unavailable(lineList.labels()));
        } finally {
            MDC.remove(MDC_SPECTRUM);
        }
    }

    private void reportProgress(int done, int total) {
        if (done % progressInterval == 0 || done == total) {
            LOGGER.info("Measured {}/{} spectra", done, total);
        }
    }
}
