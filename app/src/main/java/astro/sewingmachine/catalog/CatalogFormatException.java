package astro.sewingmachine.catalog;

/**
 * Raised when a catalog is unreadable or an identifier cell is neither text nor decodable bytes.
 */
public class CatalogFormatException extends RuntimeException {

    public CatalogFormatException(String message) {
        super(message);
    }

    public CatalogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
