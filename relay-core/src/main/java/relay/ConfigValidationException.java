package relay;

import java.util.Objects;

/**
 * Thrown when a destination configuration is rejected before anything is written.
 *
 * <p>{@link #field()} names the offending attribute using the persisted document's
 * field names (for example {@code webhookUrl} or {@code watermark.fontSize}).
 */
public class ConfigValidationException extends RuntimeException {

    private final String field;

    public ConfigValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = Objects.requireNonNull(field, "field");
    }

    /**
     * Returns the name of the rejected field.
     *
     * @return the field name, never null
     */
    public String field() {
        return field;
    }
}
