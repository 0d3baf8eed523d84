package buzzscope.model.repository;

public class CacheException extends Exception {
    public enum Kind { CORRUPT, IO_FAILURE }

    private final Kind kind;

    public CacheException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CacheException(Kind kind, String message) {
        this(kind, message, null);
    }

    public Kind kind() { return kind; }
}
