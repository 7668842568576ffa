package ai.masked.translator.translate;

/**
 * Vendor stopped generating before the translation was complete.
 */
public class TruncatedResponseException extends ResponseFormatException {

    public TruncatedResponseException(String message, String rawBody) {
        super(message, rawBody);
    }
}
