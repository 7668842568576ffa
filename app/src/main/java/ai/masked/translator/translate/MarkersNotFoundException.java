package ai.masked.translator.translate;

/**
 * Content came back without the translation markers around it.
 */
public class MarkersNotFoundException extends ResponseFormatException {

    public MarkersNotFoundException(String message, String rawBody) {
        super(message, rawBody);
    }
}
