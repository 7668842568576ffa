package ai.masked.translator.translate;

/**
 * Response body is not the JSON shape the vendor documents.
 */
public class MalformedResponseException extends ResponseFormatException {

    public MalformedResponseException(String message, String rawBody) {
        super(message, rawBody);
    }

    public MalformedResponseException(String message, String rawBody, Throwable cause) {
        super(message, rawBody, cause);
    }
}
