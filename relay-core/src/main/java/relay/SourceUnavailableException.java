package relay;

/**
 * Thrown at startup when the source event stream cannot be opened. This is the only
 * failure the relay propagates to its caller; everything after startup is resolved
 * internally and surfaced through stats and logs.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
