package astro.sewingmachine.spectrum;

import astro.sewingmachine.catalog.CatalogEntry;

/**
 * Source of flux and error spectra for catalog entries.
 */
@FunctionalInterface
public interface SpectrumProvider {

    /**
     * @throws SpectrumUnavailableException when no spectrum exists for the entry
     */
    Spectrum fetch(CatalogEntry entry);
}
