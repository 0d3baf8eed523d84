package buzzscope.model.service.monitor;

/** The cycle stopped before delivering anything. */
public class MonitorException extends Exception {
    public MonitorException(String message, Throwable cause) { super(message, cause); }
}
