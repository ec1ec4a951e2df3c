package astro.sewingmachine.catalog;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One catalog row as read: the location (or field) key and the object identifier in whatever
 * form the catalog stored them. Text, byte and integral forms normalize to trimmed text.
 */
public record CatalogEntry(int row, Object rawLocation, Object rawObjectId) {

    public CatalogEntry {
        if (row < 0) {
            throw new IllegalArgumentException("row must not be negative");
        }
    }

    public static CatalogEntry of(int row, String location, String objectId) {
        return new CatalogEntry(row, location, objectId);
    }

    /**
     * @throws CatalogFormatException if the stored value cannot be turned into text
     */
    public String locationKey() {
        return normalize(rawLocation, "location");
    }

    /**
     * @throws CatalogFormatException if the stored value cannot be turned into text
     */
    public String objectId() {
        return normalize(rawObjectId, "object id");
    }

    /**
     * Object identifier for logs and output rows; never throws.
     */
    public String displayId() {
        try {
            return objectId();
        } catch (CatalogFormatException ex) {
            return "row-" + row;
        }
    }

    private String normalize(Object value, String field) {
        String text;
        if (value instanceof String string) {
            text = string;
        } else if (value instanceof byte[] bytes) {
            text = decode(bytes, field);
        } else if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            text = value.toString();
        } else {
            throw new CatalogFormatException(String.format("Row %d: %s has unsupported type %s", row, field,
                    value == null ? "null" : value.getClass().getSimpleName()));
        }
        text = text.strip();
        if (text.isEmpty()) {
            throw new CatalogFormatException(String.format("Row %d: %s is blank", row, field));
        }
        return text;
    }

    private String decode(byte[] bytes, String field) {
        int length = bytes.length;
        while (length > 0 && bytes[length - 1] == 0) {
            length--;
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, 0, length))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new CatalogFormatException(String.format("Row %d: %s bytes are not valid UTF-8", row, field), ex);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CatalogEntry that)) {
            return false;
        }
        return row == that.row && Objects.deepEquals(rawLocation, that.rawLocation) && Objects.deepEquals(rawObjectId, that.rawObjectId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, Objects.hashCode(displayId()));
    }
}
