package ai.masked.translator.translate;

public class TemplateNotFoundException extends ConfigurationException {

    public TemplateNotFoundException(String message) {
        super(message);
    }
}
