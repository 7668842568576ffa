package ai.masked.translator.translate;

/**
 * Setup problem detected before any I/O, such as an unknown model or vendor.
 */
public class ConfigurationException extends TranslationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
