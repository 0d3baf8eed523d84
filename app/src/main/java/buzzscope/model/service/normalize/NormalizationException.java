package buzzscope.model.service.normalize;

/** A raw record that cannot become a {@code Post}. The record is dropped, the batch goes on. */
public class NormalizationException extends Exception {
    public NormalizationException(String message) { super(message); }
}
