package ai.masked.translator.translate;

public class FormatNotFoundException extends ConfigurationException {

    public FormatNotFoundException(String message) {
        super(message);
    }
}
