package buzzscope.model.service.collect;

/** A collect call that produced nothing usable. */
public class CollectionException extends Exception {
    public CollectionException(String message) { super(message); }
    public CollectionException(String message, Throwable cause) { super(message, cause); }
}
