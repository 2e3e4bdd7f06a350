package villagecompute.newsdigest.exceptions;

/**
 * Exception thrown when the archival sink cannot store a run.
 *
 * <p>
 * Archive failures are reported but never roll back notifications that were already delivered.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
