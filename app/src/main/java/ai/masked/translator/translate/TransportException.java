package ai.masked.translator.translate;

import ai.masked.translator.http.SecretMasker;

/**
 * Network failure, or an HTTP error status the vendor does not describe in its body.
 */
public class TransportException extends TranslationException {

    private final int status;
    private String body;

    public TransportException(String message, int status, String body) {
        super(message);
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.body = "";
    }

    /**
     * HTTP status, or 0 when no response was received.
     */
    public int status() {
        return status;
    }

    public String body() {
        return body;
    }

    @Override
    public TranslationException redact(SecretMasker masker) {
        body = masker.mask(body);
        return super.redact(masker);
    }
}
