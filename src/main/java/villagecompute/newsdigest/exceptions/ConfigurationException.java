package villagecompute.newsdigest.exceptions;

/**
 * Exception thrown when required configuration is missing or invalid.
 *
 * <p>
 * Raised during startup validation so the process aborts before any network call is made.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
