package buzzscope.collector.core;

public enum CollectorError {
    RATE_LIMITED(true),
    AUTH_INVALID(false),
    NETWORK_ERROR(true),
    NOT_SUPPORTED(false);

    private final boolean retryable;

    CollectorError(boolean retryable) { this.retryable = retryable; }

    public boolean retryable() { return retryable; }
}
