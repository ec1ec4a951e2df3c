package astro.sewingmachine.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class CatalogEntryTest {

    @Test
    void decodesByteIdentifiersAndTrimsPadding() {
        CatalogEntry entry = new CatalogEntry(3, "apo25m ".getBytes(StandardCharsets.UTF_8),
                new byte[] {'2', 'M', '1', '2', 0, 0});

        assertThat(entry.locationKey()).isEqualTo("apo25m");
        assertThat(entry.objectId()).isEqualTo("2M12");
    }

    @Test
    void acceptsIntegralLocationIds() {
        assertThat(new CatalogEntry(0, 4102, "x").locationKey()).isEqualTo("4102");
        assertThat(new CatalogEntry(0, (short) 12, "x").locationKey()).isEqualTo("12");
        assertThat(new CatalogEntry(0, 7L, "x").locationKey()).isEqualTo("7");
    }

    @Test
    void rejectsUnsupportedOrBlankValues() {
        assertThatThrownBy(() -> new CatalogEntry(1, 1.5, "x").locationKey())
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("Double");
        assertThatThrownBy(() -> CatalogEntry.of(1, "a", "  ").objectId())
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("blank");
        assertThatThrownBy(() -> new CatalogEntry(1, null, "x").locationKey())
                .isInstanceOf(CatalogFormatException.class);
    }

    @Test
    void rejectsInvalidUtf8() {
        CatalogEntry entry = new CatalogEntry(5, "f", new byte[] {(byte) 0xFF, 'a'});

        assertThatThrownBy(entry::objectId)
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("UTF-8");
        assertThat(entry.displayId()).isEqualTo("row-5");
    }

    @Test
    void comparesByteArraysByContent() {
        CatalogEntry first = new CatalogEntry(0, "f", new byte[] {'a'});
        CatalogEntry second = new CatalogEntry(0, "f", new byte[] {'a'});

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    }
}
