package space.ketterling.sensornet.aggregate;

/**
 * A well-formed aggregate request whose parameters cannot produce a result,
 * such as a window with no observations or a numeric function over a text
 * column. Reported as HTTP 422.
 */
public class UnprocessableQueryException extends RuntimeException {
    public UnprocessableQueryException(String message) {
        super(message);
    }
}
