package expansion.utility;

/**
 * Thrown when input data is malformed or inconsistent. Raised before any optimization starts.
 */
public class DataException extends OptException {
    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
