package villagecompute.newsdigest.exceptions;

/**
 * Exception thrown when an analysis response cannot be turned into a typed result.
 *
 * <p>
 * Extends RuntimeException per project standards. The {@link Reason} lets callers record why an item was skipped
 * without inspecting message text.
 */
public class AnalysisValidationException extends RuntimeException {

    /**
     * Validation failure categories.
     */
    public enum Reason {
        EMPTY_RESPONSE, UNPARSEABLE, NOT_AN_OBJECT, MISSING_FIELD
    }

    private final Reason reason;

    public AnalysisValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AnalysisValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
