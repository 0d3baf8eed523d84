package buzzscope.collector.core;

/**
 * Failure of one platform fetch. The {@link CollectorError} kind decides whether
 * the caller may retry.
 */
public class CollectorException extends Exception {
    private final CollectorError error;

    public CollectorException(CollectorError error, String message) {
        super(message);
        this.error = error;
    }

    public CollectorException(CollectorError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public CollectorError error() { return error; }

    public static CollectorException notSupported(Platform platform, Mode mode) {
        return new CollectorException(CollectorError.NOT_SUPPORTED,
                platform.displayName() + " has no " + mode.id() + " listing");
    }
}
