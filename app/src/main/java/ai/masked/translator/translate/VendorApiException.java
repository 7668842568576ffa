package ai.masked.translator.translate;

/**
 * Vendor returned a structured error envelope.
 */
public class VendorApiException extends ResponseFormatException {

    public VendorApiException(String message, String rawBody) {
        super(message, rawBody);
    }
}
