package relay;

/**
 * Thrown when the durable layer of a destination config store fails to read or write.
 * The in-memory view is left as it was before the failing call.
 */
public class ConfigStoreException extends RuntimeException {

    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigStoreException(String message) {
        super(message);
    }
}
