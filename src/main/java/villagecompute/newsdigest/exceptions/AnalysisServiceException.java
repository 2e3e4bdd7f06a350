package villagecompute.newsdigest.exceptions;

/**
 * Exception thrown when the external analysis service call fails (timeout, non-2xx response, transport error).
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class AnalysisServiceException extends RuntimeException {

    public AnalysisServiceException(String message) {
        super(message);
    }

    public AnalysisServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
