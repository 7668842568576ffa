package ai.masked.translator.translate;

/**
 * A driver needs a value (model name, per-call variable) that was not configured.
 */
public class MissingConfigException extends ConfigurationException {

    public MissingConfigException(String message) {
        super(message);
    }
}
